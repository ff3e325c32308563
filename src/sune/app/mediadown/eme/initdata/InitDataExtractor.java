package sune.app.mediadown.eme.initdata;

import java.util.Base64;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

import org.slf4j.Logger;

import sune.app.mediadown.eme.EMEConstants;
import sune.app.mediadown.eme.EMELog;
import sune.app.mediadown.eme.KeySystem;

public final class InitDataExtractor {
	
	private static final Logger logger = EMELog.get();
	private static final String ENCODING_BASE64 = "base64";
	private static final Pattern WHITESPACE = Pattern.compile("\\s+");
	
	private final ProtectionPsshState psshState;
	
	public InitDataExtractor(ProtectionPsshState psshState) {
		this.psshState = Objects.requireNonNull(psshState);
	}
	
	private static final LevelKey selectKey(KeySystem keySystem, List<LevelKey> keys) {
		String drmIdentifier = keySystem.drmIdentifier();
		return keys.stream()
					.filter((k) -> drmIdentifier.equals(k.keyFormat()))
					.findFirst().orElse(null);
	}
	
	private static final byte[] initData(KeySystem keySystem, String encoding, String pssh) {
		if(!encoding.contains(ENCODING_BASE64)) {
			return null;
		}
		
		byte[] payload;
		try {
			payload = Base64.getDecoder().decode(WHITESPACE.matcher(pssh).replaceAll(""));
		} catch(IllegalArgumentException ex) {
			throw new IllegalArgumentException("Malformed base64 PSSH in protection metadata: " + pssh, ex);
		}
		
		switch(keySystem) {
			case PLAYREADY:
				return PSSHBox.playReady(payload);
			case WIDEVINE:
				// Widevine PSSH is already a complete box
				return payload;
			default:
				return null;
		}
	}
	
	public InitData extract(KeySystem keySystem, List<LevelKey> keys) {
		Objects.requireNonNull(keySystem);
		Objects.requireNonNull(keys);
		
		LevelKey key = selectKey(keySystem, keys);
		
		if(key == null || key.relativeURI() == null) {
			throw new IllegalArgumentException(
				"No protection metadata for key format " + keySystem.drmIdentifier()
			);
		}
		
		String[] details = key.relativeURI().split(",", 2);
		
		if(details.length < 2) {
			throw new IllegalArgumentException("Malformed protection metadata URI: " + key.relativeURI());
		}
		
		String encoding = details[0];
		String pssh = details[1];
		byte[] data = initData(keySystem, encoding, pssh);
		psshState.current(pssh);
		
		if(data == null) {
			logger.warn("Unsupported init data encoding: {}", encoding);
		} else if(logger.isDebugEnabled()) {
			logger.debug("Extracted init data for key-system \"{}\" (length: {})", keySystem.id(), data.length);
		}
		
		return new InitData(EMEConstants.INIT_DATA_TYPE_CENC, data, pssh);
	}
}
