package sune.app.mediadown.eme.initdata;

import java.util.Objects;

public final class ProtectionPsshState {
	
	private String currentPssh;
	private String lastProcessedPssh;
	
	public synchronized void current(String pssh) {
		this.currentPssh = pssh;
	}
	
	public synchronized boolean isDuplicate() {
		return Objects.equals(currentPssh, lastProcessedPssh);
	}
	
	public synchronized boolean markProcessed() {
		if(Objects.equals(currentPssh, lastProcessedPssh)) {
			return false;
		}
		
		lastProcessedPssh = currentPssh;
		return true;
	}
	
	public synchronized void reset() {
		lastProcessedPssh = null;
	}
	
	public synchronized String currentPssh() {
		return currentPssh;
	}
	
	public synchronized String lastProcessedPssh() {
		return lastProcessedPssh;
	}
}
