package sune.app.mediadown.eme.cdm;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import sune.app.mediadown.eme.KeySystem;

@FunctionalInterface
public interface KeySystemAccessProvider {
	
	CompletableFuture<KeySystemAccess> requestAccess(KeySystem keySystem,
			List<KeySystemConfiguration> configurations);
}
