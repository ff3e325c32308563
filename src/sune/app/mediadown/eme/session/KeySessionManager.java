package sune.app.mediadown.eme.session;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;

import sune.app.mediadown.eme.EMELog;
import sune.app.mediadown.eme.cdm.MediaKeySession;
import sune.app.mediadown.eme.error.ErrorReporter;
import sune.app.mediadown.eme.error.KeySystemErrorKind;
import sune.app.mediadown.eme.initdata.ProtectionPsshState;
import sune.app.mediadown.eme.license.LicenseRequestProtocol;
import sune.app.mediadown.eme.util.Futures;

public final class KeySessionManager {
	
	private static final Logger logger = EMELog.get();
	
	private final SessionStore store;
	private final LicenseRequestProtocol protocol;
	private final ErrorReporter reporter;
	private final ProtectionPsshState psshState;
	private volatile boolean haveKeySession;
	
	public KeySessionManager(SessionStore store, LicenseRequestProtocol protocol, ErrorReporter reporter,
			ProtectionPsshState psshState) {
		this.store = Objects.requireNonNull(store);
		this.protocol = Objects.requireNonNull(protocol);
		this.reporter = Objects.requireNonNull(reporter);
		this.psshState = Objects.requireNonNull(psshState);
	}
	
	private final void onNewSession(SessionItem item, MediaKeySession session) {
		logger.info("New key-system session {} ({})", session.sessionId(), item.id());
		session.messageListener((s, message) -> onSessionMessage(item, s, message));
	}
	
	private final void onSessionMessage(SessionItem item, MediaKeySession session, byte[] message) {
		logger.info("Got key message, creating license request");
		protocol.requestLicense(item, message, (data) -> updateSession(item, session, data));
	}
	
	private final CompletableFuture<Void> updateSession(SessionItem item, MediaKeySession session, byte[] data) {
		logger.info("Received license data (length: {}), updating key-session", data != null ? data.length : 0);
		
		return Futures.call(() -> session.update(data)).handle((v, ex) -> {
			if(ex != null) {
				logger.error("Key-session update failed ({})", item.id(), Futures.unwrap(ex));
				item.markFailed();
			} else {
				item.markLicenseExchanged();
			}
			
			return null;
		});
	}
	
	public void createMissingSessions() {
		for(SessionItem item : store.items()) {
			MediaKeySession session;
			try {
				session = item.attachSessionIfAbsent(() -> item.mediaKeys().createSession());
			} catch(RuntimeException ex) {
				logger.error("Failed to create key-session ({})", item.id(), ex);
				continue;
			}
			
			if(session == null) {
				continue;
			}
			
			haveKeySession = true;
			onNewSession(item, session);
		}
	}
	
	public CompletableFuture<Void> generateRequestForActiveSession(String initDataType, byte[] initData) {
		SessionItem item = store.active();
		
		if(item == null) {
			psshState.reset();
			reporter.fatal(
				KeySystemErrorKind.NO_ACCESS,
				"Media is encrypted but not any key-system access has been obtained yet"
			);
			return Futures.done();
		}
		
		MediaKeySession session = item.session();
		
		if(session == null) {
			reporter.fatal(
				KeySystemErrorKind.NO_SESSION,
				"Media is encrypted but no key-session existing"
			);
			return Futures.done();
		}
		
		if(item.isInitialized()) {
			logger.warn("Key-session already initialized but requested again");
			return Futures.done();
		}
		
		if(item.state() == SessionItemState.FAILED) {
			logger.warn("Key-session {} failed, request not generated", item.id());
			return Futures.done();
		}
		
		// Init data is null if the media is not CORS-same-origin
		if(initData == null) {
			reporter.fatal(
				KeySystemErrorKind.NO_INIT_DATA,
				"Init data required for generating a key session is null"
			);
			return Futures.done();
		}
		
		// Concurrent replays must not get past this point
		if(!item.markRequestGenerated()) {
			logger.warn("Key-session already initialized but requested again");
			return Futures.done();
		}
		
		logger.info("Generating key-session request for \"{}\" init data type", initDataType);
		
		return Futures.call(() -> session.generateRequest(initDataType, initData)).handle((v, ex) -> {
			if(ex != null) {
				reporter.nonFatal(
					KeySystemErrorKind.NO_SESSION,
					"Error generating key-session request",
					Futures.unwrap(ex)
				);
			} else if(logger.isDebugEnabled()) {
				logger.debug("Key-session generation succeeded");
			}
			
			return null;
		});
	}
	
	public boolean haveKeySession() {
		return haveKeySession;
	}
}
