package sune.app.mediadown.eme.license;

@FunctionalInterface
public interface LicenseCallback {
	
	void onLicense(byte[] license);
}
