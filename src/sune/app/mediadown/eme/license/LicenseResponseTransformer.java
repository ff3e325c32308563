package sune.app.mediadown.eme.license;

import java.net.URI;

@FunctionalInterface
public interface LicenseResponseTransformer {
	
	byte[] transform(LicenseResponse response, URI uri) throws Exception;
}
