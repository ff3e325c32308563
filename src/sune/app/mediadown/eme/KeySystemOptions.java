package sune.app.mediadown.eme;

public final class KeySystemOptions {
	
	private static final KeySystemOptions DEFAULT = new KeySystemOptions(null, null);
	
	private final String audioRobustness;
	private final String videoRobustness;
	
	public KeySystemOptions(String audioRobustness, String videoRobustness) {
		this.audioRobustness = audioRobustness;
		this.videoRobustness = videoRobustness;
	}
	
	public static final KeySystemOptions ofDefault() {
		return DEFAULT;
	}
	
	private static final String orEmpty(String value) {
		return value != null ? value : "";
	}
	
	public String audioRobustness() {
		return orEmpty(audioRobustness);
	}
	
	public String videoRobustness() {
		return orEmpty(videoRobustness);
	}
}
