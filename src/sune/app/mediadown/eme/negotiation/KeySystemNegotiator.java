package sune.app.mediadown.eme.negotiation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;

import sune.app.mediadown.eme.EMELog;
import sune.app.mediadown.eme.KeySystem;
import sune.app.mediadown.eme.KeySystemOptions;
import sune.app.mediadown.eme.UnsupportedKeySystemException;
import sune.app.mediadown.eme.cdm.KeySystemAccess;
import sune.app.mediadown.eme.cdm.KeySystemAccessProvider;
import sune.app.mediadown.eme.cdm.KeySystemConfiguration;
import sune.app.mediadown.eme.cdm.MediaCapability;
import sune.app.mediadown.eme.cdm.MediaKeys;
import sune.app.mediadown.eme.session.SessionItem;
import sune.app.mediadown.eme.session.SessionStore;
import sune.app.mediadown.eme.util.Futures;

public final class KeySystemNegotiator {
	
	private static final Logger logger = EMELog.get();
	
	private final KeySystemAccessProvider accessProvider;
	private final SessionStore store;
	private CompletableFuture<MediaKeys> mediaKeys;
	
	public KeySystemNegotiator(KeySystemAccessProvider accessProvider, SessionStore store) {
		this.accessProvider = Objects.requireNonNull(accessProvider);
		this.store = Objects.requireNonNull(store);
	}
	
	public static final List<KeySystemConfiguration> configurations(KeySystem keySystem, List<String> audioCodecs,
			List<String> videoCodecs, KeySystemOptions options) {
		if(keySystem == null) {
			throw new UnsupportedKeySystemException(null);
		}
		
		switch(keySystem) {
			case WIDEVINE:
			case PLAYREADY: {
				List<MediaCapability> audio = new ArrayList<>(audioCodecs.size());
				List<MediaCapability> video = new ArrayList<>(videoCodecs.size());
				
				for(String codec : audioCodecs) {
					audio.add(MediaCapability.ofAudio(codec, options.audioRobustness()));
				}
				
				for(String codec : videoCodecs) {
					video.add(MediaCapability.ofVideo(codec, options.videoRobustness()));
				}
				
				return List.of(new KeySystemConfiguration(audio, video));
			}
			default:
				throw new UnsupportedKeySystemException(keySystem.id());
		}
	}
	
	private final synchronized CompletableFuture<MediaKeys> mediaKeys(KeySystem keySystem, KeySystemAccess access) {
		if(mediaKeys != null) {
			return mediaKeys;
		}
		
		CompletableFuture<MediaKeys> future = Futures.call(access::createMediaKeys);
		mediaKeys = future;
		
		future.whenComplete((keys, ex) -> {
			if(ex == null) {
				logger.info("Media-keys created for key-system \"{}\"", keySystem.id());
				return;
			}
			
			logger.error("Failed to create media-keys", Futures.unwrap(ex));
			
			synchronized(this) {
				// Allow a later negotiation to try again
				if(mediaKeys == future) {
					mediaKeys = null;
				}
			}
		});
		
		return future;
	}
	
	private final CompletableFuture<MediaKeys> onAccessObtained(KeySystem keySystem, KeySystemAccess access) {
		logger.info("Access for key-system \"{}\" obtained", keySystem.id());
		SessionItem item = store.newItem(keySystem, access);
		
		return mediaKeys(keySystem, access).thenApply((keys) -> {
			item.grantAccess(keys);
			store.add(item);
			return keys;
		});
	}
	
	/**
	 * Requests access to the key system and resolves the CDM instance. A failure of
	 * the request is only logged, no session item is added in such case and the
	 * returned future completes exceptionally.
	 * @throws UnsupportedKeySystemException if the key system is not known, before
	 *         the access provider is called
	 */
	public CompletableFuture<MediaKeys> requestAccess(String keySystemId, List<String> audioCodecs,
			List<String> videoCodecs, KeySystemOptions options) {
		KeySystem keySystem = KeySystem.from(keySystemId);
		
		if(keySystem == null) {
			throw new UnsupportedKeySystemException(keySystemId);
		}
		
		List<KeySystemConfiguration> configurations = configurations(
			keySystem, audioCodecs, videoCodecs, options != null ? options : KeySystemOptions.ofDefault()
		);
		
		logger.info("Requesting encrypted media key-system access");
		
		CompletableFuture<KeySystemAccess> access
			= Futures.call(() -> accessProvider.requestAccess(keySystem, configurations));
		
		access.whenComplete((a, ex) -> {
			if(ex != null) {
				logger.error("Failed to obtain key-system \"{}\" access", keySystem.id(), Futures.unwrap(ex));
			}
		});
		
		return access.thenCompose((a) -> onAccessObtained(keySystem, a));
	}
	
	public synchronized MediaKeys currentMediaKeys() {
		CompletableFuture<MediaKeys> future = mediaKeys;
		
		if(future == null || !future.isDone() || future.isCompletedExceptionally()) {
			return null;
		}
		
		return future.join();
	}
}
