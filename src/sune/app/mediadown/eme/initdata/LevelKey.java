package sune.app.mediadown.eme.initdata;

/**
 * A protection metadata entry of a playlist (an {@code EXT-X-KEY} tag).
 * The relative URI of DRM keys has the form {@code <encoding>,<pssh>}, e.g.
 * {@code data:text/plain;base64,AAAAW3Bzc2g...}.
 */
public final class LevelKey {
	
	private final String method;
	private final String keyFormat;
	private final String keyFormatVersions;
	private final String relativeURI;
	
	public LevelKey(String method, String keyFormat, String keyFormatVersions, String relativeURI) {
		this.method = method;
		this.keyFormat = keyFormat;
		this.keyFormatVersions = keyFormatVersions;
		this.relativeURI = relativeURI;
	}
	
	public static final LevelKey of(String keyFormat, String relativeURI) {
		return new LevelKey("SAMPLE-AES", keyFormat, "1", relativeURI);
	}
	
	public String method() {
		return method;
	}
	
	public String keyFormat() {
		return keyFormat;
	}
	
	public String keyFormatVersions() {
		return keyFormatVersions;
	}
	
	public String relativeURI() {
		return relativeURI;
	}
}
