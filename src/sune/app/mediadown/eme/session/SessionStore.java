package sune.app.mediadown.eme.session;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import sune.app.mediadown.eme.KeySystem;
import sune.app.mediadown.eme.cdm.KeySystemAccess;

public final class SessionStore {
	
	private final AtomicInteger counter = new AtomicInteger();
	private final Map<String, SessionItem> items = new LinkedHashMap<>();
	private String activeId;
	
	public SessionItem newItem(KeySystem keySystem, KeySystemAccess access) {
		return new SessionItem("session-item-" + counter.incrementAndGet(), keySystem, access);
	}
	
	public synchronized void add(SessionItem item) {
		if(!item.state().equals(SessionItemState.ACCESS_GRANTED)) {
			throw new IllegalStateException("Only items with granted access can be added");
		}
		
		items.put(item.id(), item);
		activeId = item.id();
	}
	
	public synchronized SessionItem get(String id) {
		return items.get(id);
	}
	
	public synchronized SessionItem active() {
		return activeId != null ? items.get(activeId) : null;
	}
	
	public synchronized List<SessionItem> items() {
		return new ArrayList<>(items.values());
	}
	
	public synchronized int size() {
		return items.size();
	}
	
	public synchronized boolean isEmpty() {
		return items.isEmpty();
	}
	
	public synchronized List<SessionItem> clear() {
		List<SessionItem> removed = new ArrayList<>(items.values());
		items.clear();
		activeId = null;
		return removed;
	}
}
