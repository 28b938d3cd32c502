package org.github.sipline.messages;

import java.nio.charset.StandardCharsets;
import java.text.ParseException;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.ListIterator;
import java.util.Set;
import java.util.regex.Pattern;

import javax.sip.header.CSeqHeader;
import javax.sip.header.CallIdHeader;
import javax.sip.header.ContentLengthHeader;
import javax.sip.header.ContentTypeHeader;
import javax.sip.header.FromHeader;
import javax.sip.header.RecordRouteHeader;
import javax.sip.header.RouteHeader;
import javax.sip.header.ToHeader;
import javax.sip.header.ViaHeader;
import javax.sip.message.Message;
import javax.sip.message.Request;
import javax.sip.message.Response;

import org.github.sipline.Constants;
import org.github.sipline.exceptions.MalformedMessageException;

import gov.nist.javax.sip.message.SIPMessage;
import gov.nist.javax.sip.parser.ParseExceptionListener;
import gov.nist.javax.sip.parser.StringMsgParser;

/**
 * Turns WebSocket text frames into JAIN-SIP {@link Message}s and back.
 * Holds no state, so a single instance can be shared.
 */
public class MessageCodec {

	private static final String CRLF = "\r\n";
	private static final Pattern CONTENT_LENGTH_LINE = Pattern
			.compile("^(content-length|l)[ \t]*:", Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);
	private static final String[] LEADING_HEADERS = {
		ViaHeader.NAME, RouteHeader.NAME, RecordRouteHeader.NAME
	};

	private final ParseExceptionListener strictListener = new ParseExceptionListener() {

		@Override
		@SuppressWarnings("rawtypes")
		public void handleException(ParseException exception, SIPMessage message,
				Class headerClass, String headerText, String messageText)
				throws ParseException {
			throw exception;
		}

	};

	public Message parse(String text) throws MalformedMessageException {
		if (text == null) {
			throw new MalformedMessageException("Null message.");
		}
		return parse(text.getBytes(StandardCharsets.UTF_8));
	}

	public Message parse(byte[] raw) throws MalformedMessageException {
		if (raw == null || raw.length == 0) {
			throw new MalformedMessageException("Empty message.");
		}
		int bodyStart = raw.length;
		for (int i = 0; i < raw.length; i++) {
			if (raw[i] != '\n') {
				continue;
			}
			if (i + 1 < raw.length && raw[i + 1] == '\n') {
				bodyStart = i + 2;
				break;
			}
			if (i + 2 < raw.length && raw[i + 1] == '\r' && raw[i + 2] == '\n') {
				bodyStart = i + 3;
				break;
			}
		}
		byte[] head = Arrays.copyOfRange(raw, 0, bodyStart);
		byte[] body = Arrays.copyOfRange(raw, bodyStart, raw.length);

		SIPMessage message;
		try {
			message = new StringMsgParser().parseSIPMessage(head, false, false, strictListener);
		} catch (ParseException parseException) {
			throw new MalformedMessageException(parseException.getMessage(), parseException);
		} catch (RuntimeException parserFailure) {
			throw new MalformedMessageException("Unparseable message: "
					+ parserFailure.getMessage(), parserFailure);
		}
		if (message == null) {
			throw new MalformedMessageException("Missing start-line.");
		}
		checkMandatoryHeaders(message);
		String headText = new String(head, StandardCharsets.UTF_8);
		if (CONTENT_LENGTH_LINE.matcher(headText).find()) {
			ContentLengthHeader contentLength = message.getContentLength();
			int declared = contentLength == null ? 0 : contentLength.getContentLength();
			if (declared != body.length) {
				throw new MalformedMessageException(String.format("Content-Length %d does not "
						+ "match the %d body bytes available.", declared, body.length));
			}
		}
		if (body.length > 0) {
			ContentTypeHeader contentType = (ContentTypeHeader) message
					.getHeader(ContentTypeHeader.NAME);
			if (contentType == null) {
				throw new MalformedMessageException("Body without Content-Type.");
			}
			try {
				message.setContent(body, contentType);
			} catch (ParseException parseException) {
				throw new MalformedMessageException(parseException.getMessage(), parseException);
			}
		}
		return message;
	}

	private void checkMandatoryHeaders(Message message) throws MalformedMessageException {
		for (String mandatory : new String[] { CallIdHeader.NAME, CSeqHeader.NAME,
				FromHeader.NAME, ToHeader.NAME }) {
			if (message.getHeader(mandatory) == null) {
				throw new MalformedMessageException("Missing mandatory header " + mandatory + ".");
			}
		}
		if (message instanceof Request && message.getHeader(ViaHeader.NAME) == null) {
			throw new MalformedMessageException("Request without Via.");
		}
	}

	public String buildText(Message message) {
		return new String(build(message), StandardCharsets.UTF_8);
	}

	/**
	 * Serializes with Via first, then Route and Record-Route, then every other
	 * header in insertion order. Content-Length is always recomputed and last.
	 */
	public byte[] build(Message message) {
		StringBuilder text = new StringBuilder(512);
		if (message instanceof Request) {
			Request request = (Request) message;
			text.append(request.getMethod()).append(' ').append(request.getRequestURI())
				.append(' ').append(Constants.SIP_VERSION);
		}
		else {
			Response response = (Response) message;
			text.append(Constants.SIP_VERSION).append(' ').append(response.getStatusCode())
				.append(' ').append(response.getReasonPhrase());
		}
		text.append(CRLF);
		Set<String> names = new LinkedHashSet<>(Arrays.asList(LEADING_HEADERS));
		ListIterator<?> headerNames = message.getHeaderNames();
		while (headerNames.hasNext()) {
			String name = (String) headerNames.next();
			if (!name.equalsIgnoreCase(ContentLengthHeader.NAME)) {
				names.add(name);
			}
		}
		for (String name : names) {
			ListIterator<?> headers = message.getHeaders(name);
			while (headers != null && headers.hasNext()) {
				String line = headers.next().toString();
				text.append(line);
				if (!line.endsWith(CRLF)) {
					text.append(CRLF);
				}
			}
		}
		byte[] body = message.getRawContent();
		if (body == null) {
			body = new byte[0];
		}
		text.append(ContentLengthHeader.NAME).append(": ").append(body.length).append(CRLF);
		text.append(CRLF);
		byte[] head = text.toString().getBytes(StandardCharsets.UTF_8);
		byte[] wire = Arrays.copyOf(head, head.length + body.length);
		System.arraycopy(body, 0, wire, head.length, body.length);
		return wire;
	}

}
