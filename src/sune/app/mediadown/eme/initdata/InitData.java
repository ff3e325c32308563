package sune.app.mediadown.eme.initdata;

import java.util.Objects;

public final class InitData {
	
	private final String type;
	private final byte[] data;
	private final String pssh;
	
	public InitData(String type, byte[] data, String pssh) {
		this.type = Objects.requireNonNull(type);
		this.data = data;
		this.pssh = pssh;
	}
	
	public String type() {
		return type;
	}
	
	public byte[] data() {
		return data;
	}
	
	public String pssh() {
		return pssh;
	}
	
	public boolean hasData() {
		return data != null;
	}
}
