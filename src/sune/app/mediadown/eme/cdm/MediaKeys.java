package sune.app.mediadown.eme.cdm;

public interface MediaKeys {
	
	MediaKeySession createSession();
}
