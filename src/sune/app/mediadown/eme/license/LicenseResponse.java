package sune.app.mediadown.eme.license;

import java.util.Objects;

import io.netty.handler.codec.http.EmptyHttpHeaders;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpResponseStatus;

public final class LicenseResponse {
	
	private final int status;
	private final HttpHeaders headers;
	private final byte[] body;
	
	public LicenseResponse(int status, HttpHeaders headers, byte[] body) {
		this.status = status;
		this.headers = headers != null ? headers : EmptyHttpHeaders.INSTANCE;
		this.body = Objects.requireNonNull(body);
	}
	
	public static final LicenseResponse of(int status, byte[] body) {
		return new LicenseResponse(status, null, body);
	}
	
	public int status() {
		return status;
	}
	
	public boolean isSuccess() {
		return status == HttpResponseStatus.OK.code();
	}
	
	public HttpHeaders headers() {
		return headers;
	}
	
	public byte[] body() {
		return body;
	}
}
