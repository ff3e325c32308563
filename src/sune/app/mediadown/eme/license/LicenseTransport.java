package sune.app.mediadown.eme.license;

import java.util.concurrent.CompletableFuture;

/**
 * Sends license challenges to a license server. A response with any status
 * completes the future normally, failures of the connection itself complete
 * it exceptionally.
 */
@FunctionalInterface
public interface LicenseTransport {
	
	CompletableFuture<LicenseResponse> send(LicenseRequest request);
}
