package sune.app.mediadown.eme.error;

public enum KeySystemErrorKind {
	
	NO_KEYS("keySystemNoKeys"),
	NO_ACCESS("keySystemNoAccess"),
	NO_SESSION("keySystemNoSession"),
	NO_INIT_DATA("keySystemNoInitData"),
	LICENSE_REQUEST_FAILED("keySystemLicenseRequestFailed"),
	UNSUPPORTED_KEY_SYSTEM("keySystemUnsupported");
	
	private final String details;
	
	private KeySystemErrorKind(String details) {
		this.details = details;
	}
	
	public String details() {
		return details;
	}
}
