package sune.app.mediadown.eme;

import java.util.Objects;
import java.util.Properties;

import sune.app.mediadown.eme.cdm.KeySystemAccessProvider;
import sune.app.mediadown.eme.error.KeySystemErrorListener;
import sune.app.mediadown.eme.license.LicenseRequestSetup;
import sune.app.mediadown.eme.license.LicenseResponseTransformer;
import sune.app.mediadown.eme.license.LicenseTransport;

public final class EMEConfiguration {
	
	private static final String PROPERTY_KEY_SYSTEM = "eme.keySystem";
	private static final String PROPERTY_LICENSE_WIDEVINE_URL = "eme.license.widevine.url";
	private static final String PROPERTY_LICENSE_PLAYREADY_URL = "eme.license.playready.url";
	private static final String PROPERTY_ROBUSTNESS_AUDIO = "eme.robustness.audio";
	private static final String PROPERTY_ROBUSTNESS_VIDEO = "eme.robustness.video";
	private static final String PROPERTY_DEBUG = "eme.debug";
	
	private final String keySystem;
	private final String widevineLicenseUrl;
	private final String playreadyLicenseUrl;
	private final KeySystemOptions keySystemOptions;
	private final KeySystemAccessProvider accessProvider;
	private final LicenseTransport licenseTransport;
	private final LicenseRequestSetup licenseRequestSetup;
	private final LicenseResponseTransformer licenseResponseTransformer;
	private final KeySystemErrorListener errorListener;
	private final boolean debug;
	
	private EMEConfiguration(String keySystem, String widevineLicenseUrl, String playreadyLicenseUrl,
			KeySystemOptions keySystemOptions, KeySystemAccessProvider accessProvider,
			LicenseTransport licenseTransport, LicenseRequestSetup licenseRequestSetup,
			LicenseResponseTransformer licenseResponseTransformer, KeySystemErrorListener errorListener,
			boolean debug) {
		this.keySystem = keySystem;
		this.widevineLicenseUrl = widevineLicenseUrl;
		this.playreadyLicenseUrl = playreadyLicenseUrl;
		this.keySystemOptions = keySystemOptions;
		this.accessProvider = accessProvider;
		this.licenseTransport = licenseTransport;
		this.licenseRequestSetup = licenseRequestSetup;
		this.licenseResponseTransformer = licenseResponseTransformer;
		this.errorListener = errorListener;
		this.debug = debug;
	}
	
	private static final boolean isEmpty(String value) {
		return value == null || value.isEmpty();
	}
	
	public String keySystem() {
		return keySystem;
	}
	
	public boolean isKeySystemSelected() {
		return !isEmpty(keySystem);
	}
	
	public String licenseServerUrl(KeySystem keySystem) {
		String url = null;
		
		switch(keySystem) {
			case WIDEVINE:  url = widevineLicenseUrl;  break;
			case PLAYREADY: url = playreadyLicenseUrl; break;
		}
		
		if(isEmpty(url)) {
			throw new IllegalStateException(
				"No license server URL configured for key-system \"" + keySystem.id() + "\""
			);
		}
		
		return url;
	}
	
	public KeySystemOptions keySystemOptions() {
		return keySystemOptions;
	}
	
	public KeySystemAccessProvider accessProvider() {
		if(accessProvider == null) {
			throw new IllegalStateException("No key-system access provider configured");
		}
		
		return accessProvider;
	}
	
	public LicenseTransport licenseTransport() {
		return licenseTransport;
	}
	
	public LicenseRequestSetup licenseRequestSetup() {
		return licenseRequestSetup;
	}
	
	public LicenseResponseTransformer licenseResponseTransformer() {
		return licenseResponseTransformer;
	}
	
	public KeySystemErrorListener errorListener() {
		return errorListener;
	}
	
	public boolean debug() {
		return debug;
	}
	
	public static final class Builder {
		
		private String keySystem;
		private String widevineLicenseUrl;
		private String playreadyLicenseUrl;
		private String audioRobustness;
		private String videoRobustness;
		private KeySystemAccessProvider accessProvider;
		private LicenseTransport licenseTransport;
		private LicenseRequestSetup licenseRequestSetup;
		private LicenseResponseTransformer licenseResponseTransformer;
		private KeySystemErrorListener errorListener;
		private boolean debug;
		
		public Builder() {
			keySystem = null;
			widevineLicenseUrl = null;
			playreadyLicenseUrl = null;
			audioRobustness = null;
			videoRobustness = null;
			accessProvider = null;
			licenseTransport = null;
			licenseRequestSetup = null;
			licenseResponseTransformer = null;
			errorListener = null;
			debug = false;
		}
		
		public static final Builder fromProperties(Properties properties) {
			Objects.requireNonNull(properties);
			return new Builder()
				.keySystem(properties.getProperty(PROPERTY_KEY_SYSTEM))
				.widevineLicenseUrl(properties.getProperty(PROPERTY_LICENSE_WIDEVINE_URL))
				.playreadyLicenseUrl(properties.getProperty(PROPERTY_LICENSE_PLAYREADY_URL))
				.audioRobustness(properties.getProperty(PROPERTY_ROBUSTNESS_AUDIO))
				.videoRobustness(properties.getProperty(PROPERTY_ROBUSTNESS_VIDEO))
				.debug(Boolean.parseBoolean(properties.getProperty(PROPERTY_DEBUG, "false")));
		}
		
		public EMEConfiguration build() {
			if(!isEmpty(keySystem)) {
				if(accessProvider == null) {
					throw new IllegalArgumentException("Key-system access provider must be set.");
				}
				
				if(licenseTransport == null) {
					throw new IllegalArgumentException("License transport must be set.");
				}
			}
			
			return new EMEConfiguration(keySystem, widevineLicenseUrl, playreadyLicenseUrl,
				new KeySystemOptions(audioRobustness, videoRobustness), accessProvider, licenseTransport,
				licenseRequestSetup, licenseResponseTransformer, errorListener, debug);
		}
		
		public Builder keySystem(String keySystem) {
			this.keySystem = keySystem;
			return this;
		}
		
		public Builder keySystem(KeySystem keySystem) {
			this.keySystem = keySystem != null ? keySystem.id() : null;
			return this;
		}
		
		public Builder widevineLicenseUrl(String widevineLicenseUrl) {
			this.widevineLicenseUrl = widevineLicenseUrl;
			return this;
		}
		
		public Builder playreadyLicenseUrl(String playreadyLicenseUrl) {
			this.playreadyLicenseUrl = playreadyLicenseUrl;
			return this;
		}
		
		public Builder audioRobustness(String audioRobustness) {
			this.audioRobustness = audioRobustness;
			return this;
		}
		
		public Builder videoRobustness(String videoRobustness) {
			this.videoRobustness = videoRobustness;
			return this;
		}
		
		public Builder accessProvider(KeySystemAccessProvider accessProvider) {
			this.accessProvider = accessProvider;
			return this;
		}
		
		public Builder licenseTransport(LicenseTransport licenseTransport) {
			this.licenseTransport = licenseTransport;
			return this;
		}
		
		public Builder licenseRequestSetup(LicenseRequestSetup licenseRequestSetup) {
			this.licenseRequestSetup = licenseRequestSetup;
			return this;
		}
		
		public Builder licenseResponseTransformer(LicenseResponseTransformer licenseResponseTransformer) {
			this.licenseResponseTransformer = licenseResponseTransformer;
			return this;
		}
		
		public Builder errorListener(KeySystemErrorListener errorListener) {
			this.errorListener = errorListener;
			return this;
		}
		
		public Builder debug(boolean debug) {
			this.debug = debug;
			return this;
		}
		
		public String keySystem() {
			return keySystem;
		}
		
		public String widevineLicenseUrl() {
			return widevineLicenseUrl;
		}
		
		public String playreadyLicenseUrl() {
			return playreadyLicenseUrl;
		}
		
		public boolean debug() {
			return debug;
		}
	}
}
