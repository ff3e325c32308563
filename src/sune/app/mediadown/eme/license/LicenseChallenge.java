package sune.app.mediadown.eme.license;

import java.util.List;
import java.util.Map;

import sune.app.mediadown.eme.KeySystem;

public final class LicenseChallenge {
	
	private final byte[] body;
	private final List<Map.Entry<String, String>> headers;
	
	private LicenseChallenge(byte[] body, List<Map.Entry<String, String>> headers) {
		this.body = body;
		this.headers = headers;
	}
	
	public static final LicenseChallenge of(KeySystem keySystem, byte[] keyMessage) {
		switch(keySystem) {
			case WIDEVINE:
				return new LicenseChallenge(keyMessage, List.of());
			case PLAYREADY: {
				PlayReadyKeyMessage message = PlayReadyKeyMessage.parse(keyMessage);
				return new LicenseChallenge(message.challenge(), message.headers());
			}
			default:
				throw new LicenseChallengeException("Unsupported key-system: " + keySystem.id());
		}
	}
	
	public byte[] body() {
		return body;
	}
	
	public List<Map.Entry<String, String>> headers() {
		return headers;
	}
}
