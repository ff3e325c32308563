package sune.app.mediadown.eme.session;

import java.util.Objects;
import java.util.function.Supplier;

import sune.app.mediadown.eme.KeySystem;
import sune.app.mediadown.eme.cdm.KeySystemAccess;
import sune.app.mediadown.eme.cdm.MediaKeySession;
import sune.app.mediadown.eme.cdm.MediaKeys;

public final class SessionItem {
	
	private final String id;
	private final KeySystem keySystem;
	private final KeySystemAccess access;
	
	private MediaKeys mediaKeys;
	private MediaKeySession session;
	private SessionItemState state;
	private boolean requestGenerated;
	
	SessionItem(String id, KeySystem keySystem, KeySystemAccess access) {
		this.id = Objects.requireNonNull(id);
		this.keySystem = Objects.requireNonNull(keySystem);
		this.access = Objects.requireNonNull(access);
		this.state = SessionItemState.UNINITIALIZED;
	}
	
	private final void transition(SessionItemState next) {
		if(!state.canTransitionTo(next)) {
			throw new IllegalStateException("Invalid transition of " + id + ": " + state + " -> " + next);
		}
		
		state = next;
	}
	
	public synchronized void grantAccess(MediaKeys mediaKeys) {
		transition(SessionItemState.ACCESS_GRANTED);
		this.mediaKeys = Objects.requireNonNull(mediaKeys);
	}
	
	public synchronized void attachSession(MediaKeySession session) {
		transition(SessionItemState.SESSION_CREATED);
		this.session = Objects.requireNonNull(session);
	}
	
	/**
	 * Creates and attaches a session while holding the item lock, so that concurrent
	 * callers never create more than one session for the item.
	 * @return the new session, or {@code null} if the item already has one or can
	 *         no longer get one
	 */
	public synchronized MediaKeySession attachSessionIfAbsent(Supplier<MediaKeySession> creator) {
		if(session != null || state != SessionItemState.ACCESS_GRANTED) {
			return null;
		}
		
		MediaKeySession created = Objects.requireNonNull(creator.get(), "session");
		attachSession(created);
		return created;
	}
	
	public synchronized boolean markRequestGenerated() {
		if(requestGenerated) {
			return false;
		}
		
		transition(SessionItemState.REQUEST_GENERATED);
		requestGenerated = true;
		return true;
	}
	
	public synchronized void markLicenseExchanged() {
		if(state.canTransitionTo(SessionItemState.LICENSE_EXCHANGED)) {
			state = SessionItemState.LICENSE_EXCHANGED;
		}
	}
	
	public synchronized void markFailed() {
		if(state.canTransitionTo(SessionItemState.FAILED)) {
			state = SessionItemState.FAILED;
		}
	}
	
	public String id() {
		return id;
	}
	
	public KeySystem keySystem() {
		return keySystem;
	}
	
	public KeySystemAccess access() {
		return access;
	}
	
	public synchronized MediaKeys mediaKeys() {
		return mediaKeys;
	}
	
	public synchronized MediaKeySession session() {
		return session;
	}
	
	public synchronized SessionItemState state() {
		return state;
	}
	
	public synchronized boolean isInitialized() {
		return requestGenerated;
	}
	
	@Override
	public String toString() {
		return "SessionItem[id=" + id + ", keySystem=" + keySystem.id() + ", state=" + state() + "]";
	}
}
