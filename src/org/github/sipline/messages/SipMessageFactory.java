package org.github.sipline.messages;

import java.nio.charset.StandardCharsets;
import java.text.ParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import javax.sip.InvalidArgumentException;
import javax.sip.PeerUnavailableException;
import javax.sip.SipFactory;
import javax.sip.address.Address;
import javax.sip.address.AddressFactory;
import javax.sip.address.URI;
import javax.sip.header.AllowHeader;
import javax.sip.header.CSeqHeader;
import javax.sip.header.CallIdHeader;
import javax.sip.header.ContactHeader;
import javax.sip.header.ContentTypeHeader;
import javax.sip.header.FromHeader;
import javax.sip.header.Header;
import javax.sip.header.HeaderFactory;
import javax.sip.header.MaxForwardsHeader;
import javax.sip.header.RouteHeader;
import javax.sip.header.ToHeader;
import javax.sip.header.UserAgentHeader;
import javax.sip.header.ViaHeader;
import javax.sip.message.Message;
import javax.sip.message.MessageFactory;
import javax.sip.message.Request;
import javax.sip.message.Response;

import org.github.sipline.Constants;
import org.github.sipline.exceptions.SiplineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Ascii;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;

import gov.nist.javax.sip.Utils;

/**
 * Builds the requests and responses the engine sends through the JAIN-SIP
 * message, header and address factories. Identifiers (tags, branches,
 * Call-IDs) come from the JAIN-SIP reference implementation.
 */
public class SipMessageFactory {

	private final Logger logger = LoggerFactory.getLogger(SipMessageFactory.class);

	private final MessageFactory messageMaker;
	private final HeaderFactory headerMaker;
	private final AddressFactory addressMaker;
	private final String transport;
	private final String localHost;
	private final String userAgent;
	private final String contactParameters;

	public SipMessageFactory(String transport, String userAgent, String contactParameters) {
		SipFactory factory = SipFactory.getInstance();
		try {
			messageMaker = factory.createMessageFactory();
			headerMaker = factory.createHeaderFactory();
			addressMaker = factory.createAddressFactory();
		} catch (PeerUnavailableException unexpectedException) {
			logger.error("JAIN-SIP factories are unavailable.", unexpectedException);
			throw new SiplineException("JAIN-SIP factories are unavailable.", unexpectedException);
		}
		this.transport = Ascii.toUpperCase(transport);
		this.localHost = Utils.getInstance().generateTag() + ".invalid";
		this.userAgent = userAgent;
		this.contactParameters = Strings.nullToEmpty(contactParameters);
	}

	public String getLocalHost() {
		return localHost;
	}

	public String newTag() {
		return Utils.getInstance().generateTag();
	}

	public String newBranch() {
		return Utils.getInstance().generateBranchId();
	}

	public String newCallId() {
		return Utils.getInstance().generateCallIdentifier(localHost);
	}

	public ViaHeader newVia() {
		try {
			return headerMaker.createViaHeader(localHost, -1, transport, newBranch());
		} catch (ParseException | InvalidArgumentException unexpectedException) {
			throw failure("Via", unexpectedException);
		}
	}

	public URI createUri(String uri) {
		try {
			return addressMaker.createURI(uri);
		} catch (ParseException parseException) {
			throw new SiplineException("Invalid SIP URI '" + uri + "'.", parseException);
		}
	}

	public Address createAddress(String displayName, String uri) {
		Address address = addressMaker.createAddress(createUri(uri));
		if (!Strings.isNullOrEmpty(displayName)) {
			try {
				address.setDisplayName(displayName);
			} catch (ParseException parseException) {
				throw new SiplineException("Invalid display name '" + displayName + "'.",
						parseException);
			}
		}
		return address;
	}

	/**
	 * Parses a name-addr (for instance a Record-Route value) into an address.
	 */
	public Address parseAddress(String nameAddress) {
		try {
			return addressMaker.createAddress(nameAddress);
		} catch (ParseException parseException) {
			throw new SiplineException("Invalid address '" + nameAddress + "'.", parseException);
		}
	}

	/**
	 * Contact for {@code username}: {@code <sip:user@host.invalid;transport=ws;extra>}.
	 */
	public ContactHeader createContact(String username) {
		StringBuilder uri = new StringBuilder("sip:");
		if (!Strings.isNullOrEmpty(username)) {
			uri.append(username).append('@');
		}
		uri.append(localHost).append(";transport=").append(Ascii.toLowerCase(transport));
		if (!contactParameters.isEmpty()) {
			if (!contactParameters.startsWith(";")) {
				uri.append(';');
			}
			uri.append(contactParameters);
		}
		return headerMaker.createContactHeader(createAddress(null, uri.toString()));
	}

	/**
	 * Any header from its textual value, parsed by JAIN-SIP.
	 */
	public Header createHeader(String name, String value) {
		try {
			return headerMaker.createHeader(name, value);
		} catch (ParseException parseException) {
			throw failure(name, parseException);
		}
	}

	/**
	 * Adds one Allow header per method in {@link Constants#ALLOWED_METHODS}.
	 */
	public void addAllow(Message message) {
		try {
			for (String method : Splitter.on(',').trimResults().omitEmptyStrings()
					.split(Constants.ALLOWED_METHODS)) {
				message.addHeader(headerMaker.createAllowHeader(method));
			}
		} catch (ParseException parseException) {
			throw failure(AllowHeader.NAME, parseException);
		}
	}

	public Header createExpires(int seconds) {
		try {
			return headerMaker.createExpiresHeader(seconds);
		} catch (InvalidArgumentException invalidArgument) {
			throw failure("Expires", invalidArgument);
		}
	}

	public HeaderFactory getHeaderFactory() {
		return headerMaker;
	}

	public Request createRequest(String method, URI requestUri, Address from, String fromTag,
			Address to, String toTag, String callId, long sequenceNumber) {
		return createRequest(method, requestUri, from, fromTag, to, toTag, callId,
				sequenceNumber, Collections.<Address>emptyList());
	}

	public Request createRequest(String method, URI requestUri, Address from, String fromTag,
			Address to, String toTag, String callId, long sequenceNumber, List<Address> routeSet) {
		try {
			CallIdHeader callIdHeader = headerMaker.createCallIdHeader(callId);
			CSeqHeader cseqHeader = headerMaker.createCSeqHeader(sequenceNumber, method);
			FromHeader fromHeader = headerMaker.createFromHeader((Address) from.clone(), fromTag);
			ToHeader toHeader = headerMaker.createToHeader((Address) to.clone(), toTag);
			List<ViaHeader> viaHeaders = new ArrayList<>();
			viaHeaders.add(newVia());
			MaxForwardsHeader maxForwards = headerMaker
					.createMaxForwardsHeader(Constants.MAX_FORWARDS);
			Request request = messageMaker.createRequest((URI) requestUri.clone(), method,
					callIdHeader, cseqHeader, fromHeader, toHeader, viaHeaders, maxForwards);
			for (Address route : routeSet) {
				request.addHeader(headerMaker.createRouteHeader((Address) route.clone()));
			}
			addUserAgent(request);
			return request;
		} catch (ParseException | InvalidArgumentException unexpectedException) {
			throw failure(method, unexpectedException);
		}
	}

	/**
	 * Response to {@code request}. When {@code toTag} is given and the To header
	 * carries no tag yet, it is added (every non-100 response of a dialog needs one).
	 */
	public Response createResponse(Request request, int statusCode, String toTag) {
		try {
			Response response = messageMaker.createResponse(statusCode, request);
			ToHeader to = (ToHeader) response.getHeader(ToHeader.NAME);
			if (toTag != null && to.getTag() == null && statusCode != Response.TRYING) {
				to.setTag(toTag);
			}
			addUserAgent(response);
			return response;
		} catch (ParseException parseException) {
			throw failure(String.valueOf(statusCode), parseException);
		}
	}

	/**
	 * ACK for a non-2xx final response: same branch as the INVITE, To taken from the response.
	 */
	public Request createNon2xxAck(Request invite, Response response) {
		return createInviteCompanion(invite, Request.ACK,
				(ToHeader) response.getHeader(ToHeader.NAME), false);
	}

	/**
	 * CANCEL matching {@code invite}: same branch, request-URI, From, To and CSeq number.
	 */
	public Request createCancel(Request invite) {
		return createInviteCompanion(invite, Request.CANCEL,
				(ToHeader) invite.getHeader(ToHeader.NAME), true);
	}

	private Request createInviteCompanion(Request invite, String method, ToHeader to,
			boolean withUserAgent) {
		try {
			List<ViaHeader> viaHeaders = new ArrayList<>();
			viaHeaders.add((ViaHeader) SipMessages.topViaOf(invite).clone());
			Request companion = messageMaker.createRequest(invite.getRequestURI(), method,
					(CallIdHeader) invite.getHeader(CallIdHeader.NAME).clone(),
					headerMaker.createCSeqHeader(SipMessages.sequenceNumberOf(invite), method),
					(FromHeader) invite.getHeader(FromHeader.NAME).clone(),
					(ToHeader) to.clone(), viaHeaders,
					headerMaker.createMaxForwardsHeader(Constants.MAX_FORWARDS));
			for (Header route : SipMessages.headersOf(invite, RouteHeader.NAME)) {
				companion.addHeader((Header) route.clone());
			}
			if (withUserAgent) {
				addUserAgent(companion);
			}
			return companion;
		} catch (ParseException | InvalidArgumentException unexpectedException) {
			throw failure(method, unexpectedException);
		}
	}

	/**
	 * Sets {@code body} (UTF-8) with the given {@code type/subtype}.
	 */
	public void setBody(Message message, String body, String contentType) {
		int slash = contentType.indexOf('/');
		try {
			ContentTypeHeader contentTypeHeader = headerMaker.createContentTypeHeader(
					contentType.substring(0, slash), contentType.substring(slash + 1));
			message.setContent(body.getBytes(StandardCharsets.UTF_8), contentTypeHeader);
		} catch (ParseException parseException) {
			throw failure("Content-Type", parseException);
		}
	}

	private void addUserAgent(Message message) throws ParseException {
		if (!Strings.isNullOrEmpty(userAgent)) {
			message.setHeader(headerMaker.createHeader(UserAgentHeader.NAME, userAgent));
		}
	}

	private SiplineException failure(String what, Exception cause) {
		logger.error("Could not build {}: {}.", what, cause.getMessage());
		return new SiplineException("Could not build " + what + ".", cause);
	}

}
