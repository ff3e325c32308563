package sune.app.mediadown.eme.license;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;

/**
 * Key message of a PlayReady CDM. The message is an UTF-16 encoded XML document:
 * <pre>
 * &lt;PlayReadyKeyMessage type="LicenseAcquisition"&gt;
 *   &lt;LicenseAcquisition Version="1"&gt;
 *     &lt;Challenge encoding="base64encoded"&gt;...&lt;/Challenge&gt;
 *     &lt;HttpHeaders&gt;
 *       &lt;HttpHeader&gt;&lt;name&gt;Content-Type&lt;/name&gt;&lt;value&gt;text/xml; charset=utf-8&lt;/value&gt;&lt;/HttpHeader&gt;
 *       ...
 *     &lt;/HttpHeaders&gt;
 *   &lt;/LicenseAcquisition&gt;
 * &lt;/PlayReadyKeyMessage&gt;
 * </pre>
 */
public final class PlayReadyKeyMessage {
	
	private static final char BOM = '\uFEFF';
	private static final Pattern WHITESPACE = Pattern.compile("\\s+");
	
	private final Document xml;
	
	private PlayReadyKeyMessage(Document xml) {
		this.xml = Objects.requireNonNull(xml);
	}
	
	public static final PlayReadyKeyMessage parse(byte[] keyMessage) {
		String content = new String(keyMessage, StandardCharsets.UTF_16LE);
		
		if(!content.isEmpty() && content.charAt(0) == BOM) {
			content = content.substring(1);
		}
		
		return new PlayReadyKeyMessage(Jsoup.parse(content, "", Parser.xmlParser()));
	}
	
	public byte[] challenge() {
		Element challenge = xml.selectFirst("Challenge");
		String text;
		
		if(challenge == null || (text = challenge.text().trim()).isEmpty()) {
			throw new LicenseChallengeException("Cannot find <Challenge> in key message");
		}
		
		try {
			return Base64.getDecoder().decode(WHITESPACE.matcher(text).replaceAll(""));
		} catch(IllegalArgumentException ex) {
			throw new LicenseChallengeException("Malformed <Challenge> in key message", ex);
		}
	}
	
	public List<Map.Entry<String, String>> headers() {
		List<Map.Entry<String, String>> headers = new ArrayList<>();
		
		for(Element header : xml.getElementsByTag("HttpHeader")) {
			Element name = header.getElementsByTag("name").first();
			Element value = header.getElementsByTag("value").first();
			
			if(name == null || value == null) {
				continue;
			}
			
			headers.add(Map.entry(name.text().trim(), value.text().trim()));
		}
		
		return Collections.unmodifiableList(headers);
	}
}
