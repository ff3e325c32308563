package sune.app.mediadown.eme.cdm;

import java.util.Objects;

public final class MediaCapability {
	
	private final String contentType;
	private final String robustness;
	
	public MediaCapability(String contentType, String robustness) {
		this.contentType = Objects.requireNonNull(contentType);
		this.robustness = Objects.requireNonNull(robustness);
	}
	
	public static final MediaCapability ofAudio(String codec, String robustness) {
		return new MediaCapability("audio/mp4; codecs=\"" + codec + "\"", robustness);
	}
	
	public static final MediaCapability ofVideo(String codec, String robustness) {
		return new MediaCapability("video/mp4; codecs=\"" + codec + "\"", robustness);
	}
	
	public String contentType() {
		return contentType;
	}
	
	public String robustness() {
		return robustness;
	}
	
	@Override
	public int hashCode() {
		return Objects.hash(contentType, robustness);
	}
	
	@Override
	public boolean equals(Object obj) {
		if(this == obj)
			return true;
		if(obj == null || getClass() != obj.getClass())
			return false;
		MediaCapability other = (MediaCapability) obj;
		return Objects.equals(contentType, other.contentType)
					&& Objects.equals(robustness, other.robustness);
	}
	
	@Override
	public String toString() {
		return "MediaCapability[contentType=" + contentType + ", robustness=" + robustness + "]";
	}
}
