package sune.app.mediadown.eme.initdata;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

public final class PSSHBox {
	
	public static final UUID PLAYREADY_SYSTEM_ID = UUID.fromString("9a04f079-9840-4286-ab92-e65be0885f95");
	public static final UUID WIDEVINE_SYSTEM_ID  = UUID.fromString("edef8ba9-79d6-4ace-a3c8-27dcd51d21ed");
	
	private static final byte[] TYPE = "pssh".getBytes(StandardCharsets.US_ASCII);
	// size + type + version/flags + system ID + data size
	private static final int HEADER_SIZE = 4 + 4 + 4 + 16 + 4;
	
	// Forbid anyone to create an instance of this class
	private PSSHBox() {
	}
	
	public static final byte[] build(UUID systemId, byte[] data) {
		int size = HEADER_SIZE + data.length;
		ByteBuffer buf = ByteBuffer.allocate(size);
		buf.putInt(size);
		buf.put(TYPE);
		buf.putInt(0); // Version 0, no flags
		buf.putLong(systemId.getMostSignificantBits());
		buf.putLong(systemId.getLeastSignificantBits());
		buf.putInt(data.length);
		buf.put(data);
		return buf.array();
	}
	
	/** PlayReady CDMs do not accept the raw PlayReady object, it has to be boxed. */
	public static final byte[] playReady(byte[] data) {
		return build(PLAYREADY_SYSTEM_ID, data);
	}
}
