package sune.app.mediadown.eme.license;

import sune.app.mediadown.eme.EMEException;

public final class LicenseChallengeException extends EMEException {
	
	private static final long serialVersionUID = 4052713826135566120L;
	
	public LicenseChallengeException(String message) {
		super(message);
	}
	
	public LicenseChallengeException(String message, Throwable cause) {
		super(message, cause);
	}
}
