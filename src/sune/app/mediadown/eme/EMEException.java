package sune.app.mediadown.eme;

public class EMEException extends RuntimeException {
	
	private static final long serialVersionUID = 7390142237459138201L;
	
	public EMEException(String message) {
		super(message);
	}
	
	public EMEException(String message, Throwable cause) {
		super(message, cause);
	}
}
