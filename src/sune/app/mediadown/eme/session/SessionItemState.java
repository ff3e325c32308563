package sune.app.mediadown.eme.session;

public enum SessionItemState {
	
	UNINITIALIZED,
	ACCESS_GRANTED,
	SESSION_CREATED,
	REQUEST_GENERATED,
	LICENSE_EXCHANGED,
	FAILED;
	
	public boolean canTransitionTo(SessionItemState next) {
		switch(this) {
			case UNINITIALIZED:     return next == ACCESS_GRANTED    || next == FAILED;
			case ACCESS_GRANTED:    return next == SESSION_CREATED   || next == FAILED;
			case SESSION_CREATED:   return next == REQUEST_GENERATED || next == FAILED;
			case REQUEST_GENERATED: return next == LICENSE_EXCHANGED || next == FAILED;
			case LICENSE_EXCHANGED: return next == LICENSE_EXCHANGED || next == FAILED;
			case FAILED:            return false;
			default:                return false;
		}
	}
}
