package sune.app.mediadown.eme.cdm;

import java.util.concurrent.CompletableFuture;

public interface KeySystemAccess {
	
	CompletableFuture<MediaKeys> createMediaKeys();
}
