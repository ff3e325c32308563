package sune.app.mediadown.eme.license;

@FunctionalInterface
public interface LicenseRequestSetup {
	
	void setup(LicenseRequest.Builder request) throws Exception;
}
