package sune.app.mediadown.eme.license;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;

import sune.app.mediadown.eme.EMEConfiguration;
import sune.app.mediadown.eme.EMEConstants;
import sune.app.mediadown.eme.EMELog;
import sune.app.mediadown.eme.KeySystem;
import sune.app.mediadown.eme.error.ErrorReporter;
import sune.app.mediadown.eme.error.KeySystemErrorKind;
import sune.app.mediadown.eme.session.SessionItem;
import sune.app.mediadown.eme.session.SessionStore;
import sune.app.mediadown.eme.util.Futures;

public final class LicenseRequestProtocol {
	
	private static final Logger logger = EMELog.get();
	
	private final EMEConfiguration configuration;
	private final SessionStore store;
	private final ErrorReporter reporter;
	private final AtomicInteger failureCount = new AtomicInteger();
	
	public LicenseRequestProtocol(EMEConfiguration configuration, SessionStore store, ErrorReporter reporter) {
		this.configuration = Objects.requireNonNull(configuration);
		this.store = Objects.requireNonNull(store);
		this.reporter = Objects.requireNonNull(reporter);
	}
	
	private final LicenseRequest createRequest(KeySystem keySystem, String url, byte[] keyMessage) {
		LicenseChallenge challenge = LicenseChallenge.of(keySystem, keyMessage);
		LicenseRequest.Builder builder = LicenseRequest.builder(url).body(challenge.body());
		
		for(Map.Entry<String, String> header : challenge.headers()) {
			builder.header(header.getKey(), header.getValue());
		}
		
		LicenseRequestSetup setup = configuration.licenseRequestSetup();
		
		if(setup != null) {
			try {
				setup.setup(builder);
			} catch(Exception ex) {
				logger.error("License request setup failed", ex);
			}
		}
		
		return builder.build();
	}
	
	private final byte[] transformResponse(LicenseRequest request, LicenseResponse response) {
		byte[] data = response.body();
		LicenseResponseTransformer transformer = configuration.licenseResponseTransformer();
		
		if(transformer != null) {
			try {
				data = transformer.transform(response, request.uri());
			} catch(Exception ex) {
				logger.error("License response transformation failed", ex);
			}
		}
		
		return data;
	}
	
	private final void onResponse(SessionItem item, LicenseRequest request, LicenseResponse response,
			Throwable exception, byte[] keyMessage, LicenseCallback callback) {
		if(exception == null && response != null && response.isSuccess()) {
			failureCount.set(0);
			logger.info("License request succeeded");
			byte[] data = transformResponse(request, response);
			
			try {
				callback.onLicense(data);
			} catch(RuntimeException ex) {
				logger.error("License callback failed", ex);
			}
			
			return;
		}
		
		if(exception != null) {
			logger.error("License request failed ({})", request.uri(), Futures.unwrap(exception));
		} else {
			logger.error(
				"License request failed ({}). Status: {}",
				request.uri(), response != null ? response.status() : -1
			);
		}
		
		int failures = failureCount.incrementAndGet();
		
		if(failures > EMEConstants.MAX_LICENSE_REQUEST_FAILURES) {
			item.markFailed();
			reporter.fatal(
				KeySystemErrorKind.LICENSE_REQUEST_FAILED,
				"License request failed " + failures + " times in a row"
			);
			return;
		}
		
		int attemptsLeft = EMEConstants.MAX_LICENSE_REQUEST_FAILURES - failures + 1;
		logger.warn("Retrying license request, {} attempts left", attemptsLeft);
		requestLicense(item, keyMessage, callback);
	}
	
	public void requestLicense(SessionItem item, byte[] keyMessage, LicenseCallback callback) {
		Objects.requireNonNull(item);
		Objects.requireNonNull(keyMessage);
		Objects.requireNonNull(callback);
		
		logger.info("Requesting content license for key-system");
		
		if(store.active() == null) {
			reporter.fatal(
				KeySystemErrorKind.NO_ACCESS,
				"Media is encrypted but no key-system access has been obtained yet"
			);
			return;
		}
		
		try {
			String url = configuration.licenseServerUrl(item.keySystem());
			LicenseRequest request = createRequest(item.keySystem(), url, keyMessage);
			logger.info("Sending license request to URL: {}", request.uri());
			
			CompletableFuture<LicenseResponse> future = configuration.licenseTransport().send(request);
			
			if(future == null) {
				throw new IllegalStateException("License transport returned no result");
			}
			
			future.whenComplete((response, ex) -> onResponse(item, request, response, ex, keyMessage, callback));
		} catch(Exception ex) {
			item.markFailed();
			reporter.fatal(
				KeySystemErrorKind.LICENSE_REQUEST_FAILED,
				"Failure requesting DRM license: " + ex.getMessage(),
				ex
			);
		}
	}
	
	public int failureCount() {
		return failureCount.get();
	}
}
