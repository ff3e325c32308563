package sune.app.mediadown.eme;

public enum KeySystem {
	
	WIDEVINE("com.widevine.alpha", "urn:uuid:edef8ba9-79d6-4ace-a3c8-27dcd51d21ed"),
	PLAYREADY("com.microsoft.playready", "com.microsoft.playready");
	
	private final String id;
	private final String drmIdentifier;
	
	private KeySystem(String id, String drmIdentifier) {
		this.id = id;
		this.drmIdentifier = drmIdentifier;
	}
	
	public static final KeySystem from(String value) {
		if(value == null || value.isEmpty()) {
			return null;
		}
		
		for(KeySystem keySystem : values()) {
			if(keySystem.name().equalsIgnoreCase(value)
					|| keySystem.id.equalsIgnoreCase(value)) {
				return keySystem;
			}
		}
		
		return null;
	}
	
	public String id() {
		return id;
	}
	
	public String drmIdentifier() {
		return drmIdentifier;
	}
}
