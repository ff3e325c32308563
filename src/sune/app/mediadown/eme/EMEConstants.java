package sune.app.mediadown.eme;

public final class EMEConstants {
	
	// ----- General
	public static final int TIMEOUT = 8000;
	
	// ----- License
	public static final int    MAX_LICENSE_REQUEST_FAILURES = 3;
	public static final int    LICENSE_MAX_RESPONSE_SIZE    = 16 * 1024 * 1024;
	public static final String LICENSE_REQUEST_METHOD       = "POST";
	
	// ----- Init data, see https://www.w3.org/TR/eme-initdata-registry/
	public static final String INIT_DATA_TYPE_CENC = "cenc";
	
	// Forbid anyone to create an instance of this class
	private EMEConstants() {
	}
}
