package sune.app.mediadown.eme.session;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Before;
import org.junit.Test;

import sune.app.mediadown.eme.KeySystem;
import sune.app.mediadown.eme.cdm.MediaKeySession;
import sune.app.mediadown.eme.testing.FakeKeySystemAccess;
import sune.app.mediadown.eme.testing.FakeMediaKeySession;
import sune.app.mediadown.eme.testing.FakeMediaKeys;

public class SessionItemTest {
	
	private FakeMediaKeys mediaKeys;
	private SessionStore store;
	
	@Before
	public void setUp() {
		mediaKeys = new FakeMediaKeys();
		store = new SessionStore();
	}
	
	private SessionItem grantedItem() {
		SessionItem item = store.newItem(KeySystem.WIDEVINE, new FakeKeySystemAccess(mediaKeys));
		item.grantAccess(mediaKeys);
		return item;
	}
	
	@Test
	public void newItem_isUninitialized() {
		SessionItem item = store.newItem(KeySystem.WIDEVINE, new FakeKeySystemAccess(mediaKeys));
		
		assertThat(item.state()).isEqualTo(SessionItemState.UNINITIALIZED);
		assertThat(item.isInitialized()).isFalse();
		assertThat(item.mediaKeys()).isNull();
		assertThat(item.session()).isNull();
	}
	
	@Test
	public void newItem_hasUniqueIds() {
		SessionItem first = store.newItem(KeySystem.WIDEVINE, new FakeKeySystemAccess(mediaKeys));
		SessionItem second = store.newItem(KeySystem.WIDEVINE, new FakeKeySystemAccess(mediaKeys));
		
		assertThat(first.id()).isEqualTo("session-item-1");
		assertThat(second.id()).isEqualTo("session-item-2");
	}
	
	@Test
	public void fullLifecycle_reachesLicenseExchanged() {
		SessionItem item = grantedItem();
		item.attachSession(new FakeMediaKeySession("s"));
		
		assertThat(item.markRequestGenerated()).isTrue();
		item.markLicenseExchanged();
		
		assertThat(item.state()).isEqualTo(SessionItemState.LICENSE_EXCHANGED);
		assertThat(item.isInitialized()).isTrue();
	}
	
	@Test
	public void markRequestGenerated_secondCall_returnsFalse() {
		SessionItem item = grantedItem();
		item.attachSession(new FakeMediaKeySession("s"));
		
		assertThat(item.markRequestGenerated()).isTrue();
		assertThat(item.markRequestGenerated()).isFalse();
		assertThat(item.state()).isEqualTo(SessionItemState.REQUEST_GENERATED);
	}
	
	@Test
	public void markRequestGenerated_withoutSession_throws() {
		SessionItem item = grantedItem();
		
		assertThrows(IllegalStateException.class, item::markRequestGenerated);
	}
	
	@Test
	public void attachSession_withoutAccess_throws() {
		SessionItem item = store.newItem(KeySystem.WIDEVINE, new FakeKeySystemAccess(mediaKeys));
		
		assertThrows(IllegalStateException.class, () -> item.attachSession(new FakeMediaKeySession("s")));
	}
	
	@Test
	public void markFailed_fromAnyState_isTerminal() {
		SessionItem item = grantedItem();
		item.markFailed();
		
		assertThat(item.state()).isEqualTo(SessionItemState.FAILED);
		item.markLicenseExchanged();
		assertThat(item.state()).isEqualTo(SessionItemState.FAILED);
		assertThrows(IllegalStateException.class, () -> item.attachSession(new FakeMediaKeySession("s")));
	}
	
	@Test
	public void failedAfterRequestGeneration_staysInitialized() {
		SessionItem item = grantedItem();
		item.attachSession(new FakeMediaKeySession("s"));
		item.markRequestGenerated();
		item.markFailed();
		
		assertThat(item.isInitialized()).isTrue();
	}
	
	@Test
	public void markLicenseExchanged_beforeRequestGeneration_isIgnored() {
		SessionItem item = grantedItem();
		item.markLicenseExchanged();
		
		assertThat(item.state()).isEqualTo(SessionItemState.ACCESS_GRANTED);
	}
	
	@Test
	public void failedBeforeRequestGeneration_isNotInitialized() {
		SessionItem item = grantedItem();
		item.attachSession(new FakeMediaKeySession("s"));
		item.markFailed();
		
		assertThat(item.state()).isEqualTo(SessionItemState.FAILED);
		assertThat(item.isInitialized()).isFalse();
	}
	
	@Test
	public void attachSessionIfAbsent_createsOnlyOnce() {
		SessionItem item = grantedItem();
		
		MediaKeySession first = item.attachSessionIfAbsent(mediaKeys::createSession);
		MediaKeySession second = item.attachSessionIfAbsent(mediaKeys::createSession);
		
		assertThat(first).isNotNull();
		assertThat(second).isNull();
		assertThat(item.session()).isSameInstanceAs(first);
		assertThat(mediaKeys.sessions()).hasSize(1);
		assertThat(item.state()).isEqualTo(SessionItemState.SESSION_CREATED);
	}
	
	@Test
	public void attachSessionIfAbsent_failedItem_doesNotCreate() {
		SessionItem item = grantedItem();
		item.markFailed();
		
		assertThat(item.attachSessionIfAbsent(mediaKeys::createSession)).isNull();
		assertThat(mediaKeys.sessions()).isEmpty();
	}
}
