package sune.app.mediadown.eme.cdm;

import java.util.concurrent.CompletableFuture;

@FunctionalInterface
public interface MediaSink {
	
	CompletableFuture<Void> setMediaKeys(MediaKeys mediaKeys);
}
