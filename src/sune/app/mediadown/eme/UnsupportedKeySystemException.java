package sune.app.mediadown.eme;

public final class UnsupportedKeySystemException extends EMEException {
	
	private static final long serialVersionUID = -2468052710573388471L;
	
	private final String keySystemId;
	
	public UnsupportedKeySystemException(String keySystemId) {
		super("Unknown key-system: " + keySystemId);
		this.keySystemId = keySystemId;
	}
	
	public String keySystemId() {
		return keySystemId;
	}
}
