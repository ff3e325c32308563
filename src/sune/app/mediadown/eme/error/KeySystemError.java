package sune.app.mediadown.eme.error;

import java.util.Objects;

public final class KeySystemError {
	
	public static final String TYPE = "keySystemError";
	
	private final KeySystemErrorKind kind;
	private final boolean fatal;
	private final String reason;
	private final Throwable cause;
	
	public KeySystemError(KeySystemErrorKind kind, boolean fatal, String reason, Throwable cause) {
		this.kind = Objects.requireNonNull(kind);
		this.fatal = fatal;
		this.reason = Objects.requireNonNull(reason);
		this.cause = cause;
	}
	
	public String type() {
		return TYPE;
	}
	
	public KeySystemErrorKind kind() {
		return kind;
	}
	
	public boolean isFatal() {
		return fatal;
	}
	
	public String reason() {
		return reason;
	}
	
	public Throwable cause() {
		return cause;
	}
	
	@Override
	public String toString() {
		return "KeySystemError[type=" + TYPE + ", details=" + kind.details() + ", fatal=" + fatal
					+ ", reason=" + reason + "]";
	}
}
