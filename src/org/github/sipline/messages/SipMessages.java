package org.github.sipline.messages;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.ListIterator;

import javax.sip.address.Address;
import javax.sip.address.SipURI;
import javax.sip.address.URI;
import javax.sip.header.CSeqHeader;
import javax.sip.header.CallIdHeader;
import javax.sip.header.ContactHeader;
import javax.sip.header.ContentTypeHeader;
import javax.sip.header.FromHeader;
import javax.sip.header.Header;
import javax.sip.header.ToHeader;
import javax.sip.header.ViaHeader;
import javax.sip.message.Message;
import javax.sip.message.Request;
import javax.sip.message.Response;

import org.github.sipline.Constants;

/**
 * Read-only accessors over JAIN-SIP messages for the values the engine keys on.
 */
public final class SipMessages {

	private SipMessages() {}

	public static String callIdOf(Message message) {
		CallIdHeader callId = (CallIdHeader) message.getHeader(CallIdHeader.NAME);
		return callId == null ? null : callId.getCallId();
	}

	public static long sequenceNumberOf(Message message) {
		return ((CSeqHeader) message.getHeader(CSeqHeader.NAME)).getSeqNumber();
	}

	public static String cseqMethodOf(Message message) {
		return ((CSeqHeader) message.getHeader(CSeqHeader.NAME)).getMethod();
	}

	public static ViaHeader topViaOf(Message message) {
		return (ViaHeader) message.getHeader(ViaHeader.NAME);
	}

	public static String branchOf(Message message) {
		ViaHeader via = topViaOf(message);
		return via == null ? null : via.getBranch();
	}

	public static FromHeader fromOf(Message message) {
		return (FromHeader) message.getHeader(FromHeader.NAME);
	}

	public static ToHeader toOf(Message message) {
		return (ToHeader) message.getHeader(ToHeader.NAME);
	}

	public static String fromTagOf(Message message) {
		return fromOf(message).getTag();
	}

	public static String toTagOf(Message message) {
		return toOf(message).getTag();
	}

	public static ContactHeader contactOf(Message message) {
		return (ContactHeader) message.getHeader(ContactHeader.NAME);
	}

	/**
	 * User part of a {@code sip:}/{@code sips:} address, null for any other URI.
	 */
	public static String userOf(Address address) {
		if (address == null) {
			return null;
		}
		URI uri = address.getURI();
		return uri.isSipURI() ? ((SipURI) uri).getUser() : null;
	}

	public static boolean isFinal(Response response) {
		return Constants.isFinal(response.getStatusCode());
	}

	public static boolean isSuccess(Response response) {
		return Constants.getResponseClass(response.getStatusCode())
				== Constants.ResponseClass.SUCCESS;
	}

	public static boolean hasBody(Message message) {
		byte[] body = message.getRawContent();
		return body != null && body.length > 0;
	}

	public static String bodyOf(Message message) {
		byte[] body = message.getRawContent();
		return body == null ? null : new String(body, StandardCharsets.UTF_8);
	}

	/**
	 * {@code type/subtype} of the body, lower case, without parameters.
	 */
	public static String contentTypeOf(Message message) {
		ContentTypeHeader contentType = (ContentTypeHeader) message.getHeader(ContentTypeHeader.NAME);
		if (contentType == null) {
			return null;
		}
		return (contentType.getContentType() + "/" + contentType.getContentSubType()).toLowerCase();
	}

	/**
	 * Encoded value of {@code header}, without its name.
	 */
	public static String valueOf(Header header) {
		String line = header.toString().trim();
		int colon = line.indexOf(':');
		return colon < 0 ? line : line.substring(colon + 1).trim();
	}

	public static List<Header> headersOf(Message message, String name) {
		List<Header> headers = new ArrayList<>();
		ListIterator<?> iterator = message.getHeaders(name);
		while (iterator != null && iterator.hasNext()) {
			headers.add((Header) iterator.next());
		}
		return headers;
	}

	/**
	 * Start line, for log messages.
	 */
	public static String describe(Message message) {
		if (message instanceof Request) {
			Request request = (Request) message;
			return request.getMethod() + " " + request.getRequestURI();
		}
		Response response = (Response) message;
		return response.getStatusCode() + " " + response.getReasonPhrase();
	}

}
