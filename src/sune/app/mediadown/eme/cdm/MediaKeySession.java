package sune.app.mediadown.eme.cdm;

import java.util.concurrent.CompletableFuture;

public interface MediaKeySession {
	
	String sessionId();
	void messageListener(MessageListener listener);
	
	CompletableFuture<Void> generateRequest(String initDataType, byte[] initData);
	CompletableFuture<Void> update(byte[] response);
	CompletableFuture<Void> close();
	
	@FunctionalInterface
	public static interface MessageListener {
		
		void onMessage(MediaKeySession session, byte[] message);
	}
}
