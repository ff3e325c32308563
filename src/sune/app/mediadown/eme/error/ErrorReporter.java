package sune.app.mediadown.eme.error;

import java.util.Objects;

import org.slf4j.Logger;

import sune.app.mediadown.eme.EMELog;

public final class ErrorReporter {
	
	private static final Logger logger = EMELog.get();
	private static final KeySystemErrorListener NOOP_LISTENER = (error) -> {};
	
	private final KeySystemErrorListener listener;
	
	public ErrorReporter(KeySystemErrorListener listener) {
		this.listener = listener != null ? listener : NOOP_LISTENER;
	}
	
	public void fatal(KeySystemErrorKind kind, String reason) {
		report(new KeySystemError(kind, true, reason, null));
	}
	
	public void fatal(KeySystemErrorKind kind, String reason, Throwable cause) {
		report(new KeySystemError(kind, true, reason, cause));
	}
	
	public void nonFatal(KeySystemErrorKind kind, String reason, Throwable cause) {
		report(new KeySystemError(kind, false, reason, cause));
	}
	
	public void report(KeySystemError error) {
		Objects.requireNonNull(error);
		
		if(error.isFatal()) {
			logger.error("Fatal: {} ({})", error.reason(), error.kind().details(), error.cause());
		} else {
			logger.warn("{} ({})", error.reason(), error.kind().details(), error.cause());
		}
		
		listener.onError(error);
	}
}
