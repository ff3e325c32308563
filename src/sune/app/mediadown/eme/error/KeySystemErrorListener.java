package sune.app.mediadown.eme.error;

@FunctionalInterface
public interface KeySystemErrorListener {
	
	void onError(KeySystemError error);
}
