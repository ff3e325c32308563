package sune.app.mediadown.eme;

public final class LevelCodecs {
	
	private final String audioCodec;
	private final String videoCodec;
	
	public LevelCodecs(String audioCodec, String videoCodec) {
		this.audioCodec = audioCodec;
		this.videoCodec = videoCodec;
	}
	
	public String audioCodec() {
		return audioCodec;
	}
	
	public String videoCodec() {
		return videoCodec;
	}
}
