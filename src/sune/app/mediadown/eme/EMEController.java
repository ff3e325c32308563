package sune.app.mediadown.eme;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.slf4j.Logger;

import sune.app.mediadown.eme.cdm.MediaKeySession;
import sune.app.mediadown.eme.cdm.MediaKeys;
import sune.app.mediadown.eme.cdm.MediaSink;
import sune.app.mediadown.eme.error.ErrorReporter;
import sune.app.mediadown.eme.error.KeySystemErrorKind;
import sune.app.mediadown.eme.initdata.InitData;
import sune.app.mediadown.eme.initdata.InitDataExtractor;
import sune.app.mediadown.eme.initdata.LevelKey;
import sune.app.mediadown.eme.initdata.ProtectionPsshState;
import sune.app.mediadown.eme.license.LicenseRequestProtocol;
import sune.app.mediadown.eme.negotiation.KeySystemNegotiator;
import sune.app.mediadown.eme.session.KeySessionManager;
import sune.app.mediadown.eme.session.SessionItem;
import sune.app.mediadown.eme.session.SessionStore;
import sune.app.mediadown.eme.util.Futures;

public final class EMEController {
	
	private static final Logger logger = EMELog.get();
	
	private final EMEConfiguration configuration;
	private final SessionStore store = new SessionStore();
	private final ProtectionPsshState psshState = new ProtectionPsshState();
	private final ErrorReporter reporter;
	private final LicenseRequestProtocol protocol;
	private final KeySessionManager sessionManager;
	private final InitDataExtractor initDataExtractor;
	private final KeySystemNegotiator negotiator;
	
	private volatile MediaSink media;
	private volatile boolean hasSetMediaKeys;
	private volatile CompletableFuture<MediaKeys> pendingAccess;
	private volatile InitData initData;
	private volatile List<String> audioCodecs = List.of();
	private volatile List<String> videoCodecs = List.of();
	
	public EMEController(EMEConfiguration configuration) {
		this.configuration = Objects.requireNonNull(configuration);
		
		if(configuration.debug()) {
			EMELog.enable(true, null);
		}
		
		this.reporter = new ErrorReporter(configuration.errorListener());
		this.protocol = new LicenseRequestProtocol(configuration, store, reporter);
		this.sessionManager = new KeySessionManager(store, protocol, reporter, psshState);
		this.initDataExtractor = new InitDataExtractor(psshState);
		this.negotiator = configuration.isKeySystemSelected()
			? new KeySystemNegotiator(configuration.accessProvider(), store)
			: null;
	}
	
	private static final List<String> codecs(List<LevelCodecs> levels, Function<LevelCodecs, String> mapper) {
		return levels.stream()
					.map(mapper)
					.filter((c) -> c != null && !c.isEmpty())
					.collect(Collectors.toUnmodifiableList());
	}
	
	private final boolean isActive() {
		return configuration.isKeySystemSelected();
	}
	
	private final void attemptKeySystemAccess() {
		// Throws for an unsupported key system before anything is requested
		CompletableFuture<MediaKeys> access = negotiator.requestAccess(
			configuration.keySystem(), audioCodecs, videoCodecs, configuration.keySystemOptions()
		);
		
		pendingAccess = access.thenApply((keys) -> {
			sessionManager.createMissingSessions();
			return keys;
		});
	}
	
	private final void processInitData(List<LevelKey> drmInfo) {
		KeySystem keySystem = KeySystem.from(configuration.keySystem());
		initData = initDataExtractor.extract(keySystem, drmInfo);
	}
	
	private final void attemptSetMediaKeys(MediaSink sink) {
		if(hasSetMediaKeys) {
			return;
		}
		
		SessionItem item = store.active();
		
		if(item == null || item.mediaKeys() == null) {
			// Reported as missing access by the request generation
			return;
		}
		
		logger.info("Setting keys for encrypted media");
		hasSetMediaKeys = true;
		
		Futures.call(() -> sink.setMediaKeys(item.mediaKeys())).whenComplete((v, ex) -> {
			if(ex != null) {
				logger.error("Failed to set media keys", Futures.unwrap(ex));
			}
		});
	}
	
	private final void setKeysAndStartSession(String initDataType, byte[] initData) {
		MediaSink sink = media;
		
		if(sink == null) {
			return; // Detached in the meantime
		}
		
		attemptSetMediaKeys(sink);
		sessionManager.generateRequestForActiveSession(initDataType, initData);
	}
	
	private static final CompletableFuture<CloseResult> closeSession(SessionItem item) {
		MediaKeySession session = item.session();
		return Futures.call(session::close)
					.handle((v, ex) -> new CloseResult(item.id(), ex != null ? Futures.unwrap(ex) : null));
	}
	
	private static final void logCloseResults(List<CompletableFuture<CloseResult>> futures) {
		List<CloseResult> results = futures.stream()
			.map(CompletableFuture::join)
			.collect(Collectors.toList());
		List<CloseResult> rejected = results.stream()
			.filter(CloseResult::isRejected)
			.collect(Collectors.toList());
		
		// Closing a session that generated no key requests is expected to fail
		if(logger.isDebugEnabled()) {
			for(CloseResult result : rejected) {
				logger.debug("Key-session close rejected ({}): {}", result.itemId(), result.error().toString());
			}
		}
		
		logger.info("Closed {} key-session(s), {} rejected", results.size() - rejected.size(), rejected.size());
	}
	
	public void onMediaAttached(MediaSink media) {
		if(!isActive()) {
			return;
		}
		
		this.media = Objects.requireNonNull(media);
	}
	
	/**
	 * Closes all the sessions and removes the media keys from the detached sink.
	 * Failures are only logged.
	 * @return a future completed when the cleanup is done, never exceptionally
	 */
	public CompletableFuture<Void> onMediaDetached() {
		MediaSink sink = media;
		
		if(sink == null) {
			return Futures.done();
		}
		
		media = null;
		hasSetMediaKeys = false;
		List<SessionItem> items = store.clear();
		List<CompletableFuture<CloseResult>> results = new ArrayList<>(items.size());
		
		for(SessionItem item : items) {
			if(item.session() != null) {
				results.add(closeSession(item));
			}
		}
		
		return CompletableFuture.allOf(results.toArray(CompletableFuture[]::new))
			.thenCompose((v) -> {
				logCloseResults(results);
				return Futures.call(() -> sink.setMediaKeys(null));
			})
			.handle((v, ex) -> {
				if(ex != null) {
					logger.warn("Failed to remove media keys from the media", Futures.unwrap(ex));
				}
				
				return null;
			});
	}
	
	public void onManifestParsed(List<LevelCodecs> levels) {
		if(!isActive()) {
			return;
		}
		
		audioCodecs = codecs(levels, LevelCodecs::audioCodec);
		videoCodecs = codecs(levels, LevelCodecs::videoCodec);
	}
	
	public void onFragmentLoaded(boolean foundKeys, List<LevelKey> drmInfo) {
		if(!isActive()) {
			return;
		}
		
		if(foundKeys) {
			try {
				attemptKeySystemAccess();
			} catch(UnsupportedKeySystemException ex) {
				reporter.fatal(KeySystemErrorKind.UNSUPPORTED_KEY_SYSTEM, ex.getMessage(), ex);
				return;
			}
			
			processInitData(drmInfo);
		}
		
		InitData data = initData;
		
		// Init data from the playlist, wait for a key session
		if(data != null && data.hasData() && sessionManager.haveKeySession()) {
			processMediaEncrypted(data.type(), data.data());
		}
	}
	
	public boolean onMediaEncrypted(String initDataType, byte[] initData) {
		if(!isActive() || initDataType == null || initData == null) {
			return false;
		}
		
		return processMediaEncrypted(initDataType, initData);
	}
	
	public boolean processMediaEncrypted(String initDataType, byte[] initData) {
		if(!psshState.markProcessed()) {
			logger.info("Ignore media encrypted for duplicated PSSH");
			return false;
		}
		
		logger.info("Media is encrypted using \"{}\" init data type", initDataType);
		CompletableFuture<MediaKeys> access = pendingAccess;
		
		if(access == null) {
			reporter.fatal(
				KeySystemErrorKind.NO_KEYS,
				"Media is encrypted but no CDM access or no keys have been requested"
			);
			return true;
		}
		
		// Continue regardless of the access result, missing access is reported later
		access.whenComplete((keys, ex) -> {
			try {
				setKeysAndStartSession(initDataType, initData);
			} catch(RuntimeException e) {
				logger.error("Failed to start the key-session", e);
			}
		});
		
		return true;
	}
	
	public CompletableFuture<Void> destroy() {
		return onMediaDetached();
	}
	
	public EMEConfiguration configuration() {
		return configuration;
	}
	
	public List<SessionItem> sessionItems() {
		return store.items();
	}
	
	public SessionItem activeSessionItem() {
		return store.active();
	}
	
	public boolean isMediaAttached() {
		return media != null;
	}
	
	public boolean haveKeySession() {
		return sessionManager.haveKeySession();
	}
	
	public int licenseFailureCount() {
		return protocol.failureCount();
	}
	
	ProtectionPsshState psshState() {
		return psshState;
	}
	
	InitData initData() {
		return initData;
	}
	
	private static final class CloseResult {
		
		private final String itemId;
		private final Throwable error;
		
		public CloseResult(String itemId, Throwable error) {
			this.itemId = itemId;
			this.error = error;
		}
		
		public boolean isRejected() {
			return error != null;
		}
		
		public String itemId() {
			return itemId;
		}
		
		public Throwable error() {
			return error;
		}
	}
}
