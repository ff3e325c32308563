package sune.app.mediadown.eme.license;

import static com.google.common.truth.Truth.assertThat;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.junit.Before;
import org.junit.Test;

import sune.app.mediadown.eme.EMEConfiguration;
import sune.app.mediadown.eme.KeySystem;
import sune.app.mediadown.eme.error.ErrorReporter;
import sune.app.mediadown.eme.error.KeySystemError;
import sune.app.mediadown.eme.error.KeySystemErrorKind;
import sune.app.mediadown.eme.session.SessionItem;
import sune.app.mediadown.eme.session.SessionItemState;
import sune.app.mediadown.eme.session.SessionStore;
import sune.app.mediadown.eme.testing.FakeAccessProvider;
import sune.app.mediadown.eme.testing.FakeKeySystemAccess;
import sune.app.mediadown.eme.testing.FakeLicenseTransport;
import sune.app.mediadown.eme.testing.FakeMediaKeySession;
import sune.app.mediadown.eme.testing.FakeMediaKeys;
import sune.app.mediadown.eme.testing.RecordingErrorListener;
import sune.app.mediadown.eme.testing.TestData;

public class LicenseRequestProtocolTest {
	
	private static final String WIDEVINE_URL = "https://license.example.com/widevine";
	private static final String PLAYREADY_URL = "https://license.example.com/playready?session=1";
	private static final byte[] KEY_MESSAGE = { 8, 4, 18, 33, 7 };
	
	private FakeMediaKeys mediaKeys;
	private FakeLicenseTransport transport;
	private RecordingErrorListener errors;
	private SessionStore store;
	private List<byte[]> licenses;
	
	@Before
	public void setUp() {
		mediaKeys = new FakeMediaKeys();
		transport = new FakeLicenseTransport();
		errors = new RecordingErrorListener();
		store = new SessionStore();
		licenses = new ArrayList<>();
	}
	
	private EMEConfiguration.Builder configuration() {
		return new EMEConfiguration.Builder()
			.keySystem(KeySystem.WIDEVINE)
			.widevineLicenseUrl(WIDEVINE_URL)
			.playreadyLicenseUrl(PLAYREADY_URL)
			.accessProvider(new FakeAccessProvider(mediaKeys))
			.licenseTransport(transport);
	}
	
	private LicenseRequestProtocol protocol(EMEConfiguration configuration) {
		return new LicenseRequestProtocol(configuration, store, new ErrorReporter(errors));
	}
	
	private LicenseRequestProtocol protocol() {
		return protocol(configuration().build());
	}
	
	private SessionItem activeItem(KeySystem keySystem) {
		SessionItem item = store.newItem(keySystem, new FakeKeySystemAccess(mediaKeys));
		item.grantAccess(mediaKeys);
		store.add(item);
		item.attachSession(new FakeMediaKeySession("s"));
		item.markRequestGenerated();
		return item;
	}
	
	@Test
	public void widevine_postsKeyMessageVerbatim() {
		SessionItem item = activeItem(KeySystem.WIDEVINE);
		
		protocol().requestLicense(item, KEY_MESSAGE, licenses::add);
		
		LicenseRequest request = transport.lastRequest();
		assertThat(request.uri().toString()).isEqualTo(WIDEVINE_URL);
		assertThat(request.method().name()).isEqualTo("POST");
		assertThat(request.body()).isEqualTo(KEY_MESSAGE);
		assertThat(request.headers().isEmpty()).isTrue();
		assertThat(licenses).containsExactly(FakeLicenseTransport.LICENSE);
		assertThat(errors.errors()).isEmpty();
	}
	
	@Test
	public void playReady_postsChallengeWithMessageHeaders() {
		SessionItem item = activeItem(KeySystem.PLAYREADY);
		
		protocol().requestLicense(item, TestData.playReadyMessage(), licenses::add);
		
		LicenseRequest request = transport.lastRequest();
		assertThat(request.uri().toString()).isEqualTo(PLAYREADY_URL);
		assertThat(new String(request.body(), StandardCharsets.UTF_8)).isEqualTo(TestData.CHALLENGE);
		assertThat(request.headers().get("Content-Type")).isEqualTo("text/xml; charset=utf-8");
		assertThat(request.headers().get("SOAPAction"))
			.isEqualTo("\"http://schemas.microsoft.com/DRM/2007/03/protocols/AcquireLicense\"");
		assertThat(licenses).hasSize(1);
	}
	
	@Test
	public void playReady_missingChallenge_isFatalWithoutRequest() {
		SessionItem item = activeItem(KeySystem.PLAYREADY);
		
		protocol().requestLicense(item, TestData.playReadyMessage(""), licenses::add);
		
		assertThat(transport.requestCount()).isEqualTo(0);
		assertThat(errors.kinds()).containsExactly(KeySystemErrorKind.LICENSE_REQUEST_FAILED);
		assertThat(errors.last().isFatal()).isTrue();
		assertThat(errors.last().reason()).contains("Cannot find <Challenge>");
		assertThat(item.state()).isEqualTo(SessionItemState.FAILED);
	}
	
	@Test
	public void noActiveItem_reportsNoAccess() {
		SessionItem item = store.newItem(KeySystem.WIDEVINE, new FakeKeySystemAccess(mediaKeys));
		
		protocol().requestLicense(item, KEY_MESSAGE, licenses::add);
		
		assertThat(transport.requestCount()).isEqualTo(0);
		assertThat(errors.kinds()).containsExactly(KeySystemErrorKind.NO_ACCESS);
	}
	
	@Test
	public void fatalFailure_marksOnlyEmittingItem() {
		SessionItem emitting = activeItem(KeySystem.WIDEVINE);
		SessionItem active = store.newItem(KeySystem.WIDEVINE, new FakeKeySystemAccess(mediaKeys));
		active.grantAccess(mediaKeys);
		store.add(active);
		active.attachSession(new FakeMediaKeySession("t"));
		transport.thenStatus(500, 4);
		
		protocol().requestLicense(emitting, KEY_MESSAGE, licenses::add);
		
		assertThat(store.active()).isSameInstanceAs(active);
		assertThat(emitting.state()).isEqualTo(SessionItemState.FAILED);
		assertThat(active.state()).isEqualTo(SessionItemState.SESSION_CREATED);
		assertThat(active.isInitialized()).isFalse();
		assertThat(errors.kinds()).containsExactly(KeySystemErrorKind.LICENSE_REQUEST_FAILED);
	}
	
	@Test
	public void playReadyKeyMessage_usesEmittingItemKeySystem() {
		SessionItem emitting = activeItem(KeySystem.PLAYREADY);
		SessionItem active = store.newItem(KeySystem.WIDEVINE, new FakeKeySystemAccess(mediaKeys));
		active.grantAccess(mediaKeys);
		store.add(active);
		
		protocol().requestLicense(emitting, TestData.playReadyMessage(), licenses::add);
		
		assertThat(transport.lastRequest().uri().toString()).isEqualTo(PLAYREADY_URL);
		assertThat(licenses).hasSize(1);
	}
	
	@Test
	public void missingLicenseUrl_isFatal() {
		SessionItem item = activeItem(KeySystem.WIDEVINE);
		EMEConfiguration configuration = configuration().widevineLicenseUrl(null).build();
		
		protocol(configuration).requestLicense(item, KEY_MESSAGE, licenses::add);
		
		assertThat(transport.requestCount()).isEqualTo(0);
		assertThat(errors.kinds()).containsExactly(KeySystemErrorKind.LICENSE_REQUEST_FAILED);
		assertThat(errors.last().reason()).contains("com.widevine.alpha");
	}
	
	@Test
	public void threeFailuresThenSuccess_resetsCounter() {
		SessionItem item = activeItem(KeySystem.WIDEVINE);
		transport.thenStatus(500, 3);
		LicenseRequestProtocol protocol = protocol();
		
		protocol.requestLicense(item, KEY_MESSAGE, licenses::add);
		
		assertThat(transport.requestCount()).isEqualTo(4);
		assertThat(licenses).hasSize(1);
		assertThat(protocol.failureCount()).isEqualTo(0);
		assertThat(errors.errors()).isEmpty();
	}
	
	@Test
	public void fourFailures_areFatal() {
		SessionItem item = activeItem(KeySystem.WIDEVINE);
		transport.thenStatus(403, 4);
		LicenseRequestProtocol protocol = protocol();
		
		protocol.requestLicense(item, KEY_MESSAGE, licenses::add);
		
		assertThat(transport.requestCount()).isEqualTo(4);
		assertThat(licenses).isEmpty();
		assertThat(errors.kinds()).containsExactly(KeySystemErrorKind.LICENSE_REQUEST_FAILED);
		KeySystemError error = errors.last();
		assertThat(error.isFatal()).isTrue();
		assertThat(error.reason()).isEqualTo("License request failed 4 times in a row");
		assertThat(item.state()).isEqualTo(SessionItemState.FAILED);
	}
	
	@Test
	public void failedResponse_incrementsCounterAndRetries() {
		SessionItem item = activeItem(KeySystem.WIDEVINE);
		transport.thenStatus(500).thenReturn(new CompletableFuture<>());
		LicenseRequestProtocol protocol = protocol();
		
		protocol.requestLicense(item, KEY_MESSAGE, licenses::add);
		
		assertThat(protocol.failureCount()).isEqualTo(1);
		assertThat(transport.requestCount()).isEqualTo(2);
		assertThat(errors.errors()).isEmpty();
	}
	
	@Test
	public void connectionFailure_countsAsFailedAttempt() {
		SessionItem item = activeItem(KeySystem.WIDEVINE);
		transport.thenFailure().thenFailure();
		LicenseRequestProtocol protocol = protocol();
		
		protocol.requestLicense(item, KEY_MESSAGE, licenses::add);
		
		assertThat(transport.requestCount()).isEqualTo(3);
		assertThat(licenses).hasSize(1);
		assertThat(errors.errors()).isEmpty();
	}
	
	@Test
	public void transportThrowing_isFatalWithoutRetry() {
		SessionItem item = activeItem(KeySystem.WIDEVINE);
		EMEConfiguration configuration = configuration()
			.licenseTransport((request) -> { throw new IllegalStateException("Transport closed"); })
			.build();
		
		protocol(configuration).requestLicense(item, KEY_MESSAGE, licenses::add);
		
		assertThat(errors.kinds()).containsExactly(KeySystemErrorKind.LICENSE_REQUEST_FAILED);
		assertThat(errors.last().cause()).isInstanceOf(IllegalStateException.class);
		assertThat(item.state()).isEqualTo(SessionItemState.FAILED);
	}
	
	@Test
	public void requestSetup_canModifyRequest() {
		SessionItem item = activeItem(KeySystem.WIDEVINE);
		EMEConfiguration configuration = configuration()
			.licenseRequestSetup((builder) -> builder.header("Authorization", "Bearer token").url(builder.url() + "?v=2"))
			.build();
		
		protocol(configuration).requestLicense(item, KEY_MESSAGE, licenses::add);
		
		LicenseRequest request = transport.lastRequest();
		assertThat(request.headers().get("Authorization")).isEqualTo("Bearer token");
		assertThat(request.uri().toString()).isEqualTo(WIDEVINE_URL + "?v=2");
	}
	
	@Test
	public void requestSetupFailure_stillSendsRequest() {
		SessionItem item = activeItem(KeySystem.WIDEVINE);
		EMEConfiguration configuration = configuration()
			.licenseRequestSetup((builder) -> { throw new Exception("setup failed"); })
			.build();
		
		protocol(configuration).requestLicense(item, KEY_MESSAGE, licenses::add);
		
		assertThat(transport.requestCount()).isEqualTo(1);
		assertThat(licenses).hasSize(1);
	}
	
	@Test
	public void responseTransformer_isAppliedToLicense() {
		SessionItem item = activeItem(KeySystem.WIDEVINE);
		byte[] transformed = { 42 };
		List<String> urls = new ArrayList<>();
		EMEConfiguration configuration = configuration()
			.licenseResponseTransformer((response, uri) -> {
				urls.add(uri.toString());
				return transformed;
			})
			.build();
		
		protocol(configuration).requestLicense(item, KEY_MESSAGE, licenses::add);
		
		assertThat(licenses).containsExactly(transformed);
		assertThat(urls).containsExactly(WIDEVINE_URL);
	}
}
