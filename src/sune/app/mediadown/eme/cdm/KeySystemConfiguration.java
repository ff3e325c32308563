package sune.app.mediadown.eme.cdm;

import java.util.List;
import java.util.Objects;

public final class KeySystemConfiguration {
	
	private final List<MediaCapability> audioCapabilities;
	private final List<MediaCapability> videoCapabilities;
	
	public KeySystemConfiguration(List<MediaCapability> audioCapabilities,
			List<MediaCapability> videoCapabilities) {
		this.audioCapabilities = List.copyOf(Objects.requireNonNull(audioCapabilities));
		this.videoCapabilities = List.copyOf(Objects.requireNonNull(videoCapabilities));
	}
	
	public List<MediaCapability> audioCapabilities() {
		return audioCapabilities;
	}
	
	public List<MediaCapability> videoCapabilities() {
		return videoCapabilities;
	}
	
	@Override
	public String toString() {
		return "KeySystemConfiguration[audio=" + audioCapabilities + ", video=" + videoCapabilities + "]";
	}
}
