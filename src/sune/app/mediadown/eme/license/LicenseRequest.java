package sune.app.mediadown.eme.license;

import java.net.URI;
import java.util.Objects;

import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpMethod;
import sune.app.mediadown.eme.EMEConstants;

public final class LicenseRequest {
	
	private final URI uri;
	private final HttpMethod method;
	private final HttpHeaders headers;
	private final byte[] body;
	
	private LicenseRequest(URI uri, HttpMethod method, HttpHeaders headers, byte[] body) {
		this.uri = uri;
		this.method = method;
		this.headers = headers;
		this.body = body;
	}
	
	public static final Builder builder(String url) {
		return new Builder(url);
	}
	
	public URI uri() {
		return uri;
	}
	
	public HttpMethod method() {
		return method;
	}
	
	public HttpHeaders headers() {
		return headers;
	}
	
	public byte[] body() {
		return body;
	}
	
	public static final class Builder {
		
		private String url;
		private HttpMethod method;
		private final HttpHeaders headers;
		private byte[] body;
		
		private Builder(String url) {
			this.url = Objects.requireNonNull(url);
			this.method = HttpMethod.valueOf(EMEConstants.LICENSE_REQUEST_METHOD);
			this.headers = new DefaultHttpHeaders();
			this.body = new byte[0];
		}
		
		public Builder url(String url) {
			this.url = Objects.requireNonNull(url);
			return this;
		}
		
		public Builder method(HttpMethod method) {
			this.method = Objects.requireNonNull(method);
			return this;
		}
		
		public Builder header(String name, String value) {
			headers.set(name, value);
			return this;
		}
		
		public Builder body(byte[] body) {
			this.body = Objects.requireNonNull(body);
			return this;
		}
		
		public String url() {
			return url;
		}
		
		public HttpHeaders headers() {
			return headers;
		}
		
		public LicenseRequest build() {
			return new LicenseRequest(URI.create(url), method, headers.copy(), body);
		}
	}
}
