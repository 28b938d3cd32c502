package org.github.sipline;

import javax.sip.message.Response;

public class Constants {

	public static final String SIP_VERSION = "SIP/2.0";
	public static final String WEBSOCKET_SUBPROTOCOL = "sip";
	public static final String DTMF_CONTENT_TYPE = "application/dtmf-relay";
	public static final String SDP_CONTENT_TYPE = "application/sdp";
	public static final String ALLOWED_METHODS = "INVITE, ACK, CANCEL, BYE, OPTIONS, INFO";
	public static final int MAX_FORWARDS = 70;

	public enum Transport {
		WS, WSS, UNKNOWN
	}

	public static Transport getTransport(String url) {
		if (url == null) {
			return Transport.UNKNOWN;
		}
		String lower = url.trim().toLowerCase();
		if (lower.startsWith("wss://")) {
			return Transport.WSS;
		}
		else if (lower.startsWith("ws://")) {
			return Transport.WS;
		}
		return Transport.UNKNOWN;
	}

	public enum RequestMethod {
		REGISTER, OPTIONS, INVITE, CANCEL, BYE, ACK, INFO, UNKNOWN
	}

	public static RequestMethod getRequestMethod(String method) {
		try {
			return RequestMethod.valueOf(method.toUpperCase().trim());
		}
		catch (Exception exception) {
			return RequestMethod.UNKNOWN;
		}
	}

	public enum ResponseClass {
		PROVISIONAL, SUCCESS, REDIRECT, CLIENT_ERROR, SERVER_ERROR, GLOBAL_ERROR, UNKNOWN
	}

	public static ResponseClass getResponseClass(int statusCode) {
		if (statusCode >= 100 && statusCode <= 199) {
			return ResponseClass.PROVISIONAL;
		}
		else if (statusCode >= 200 && statusCode <= 299) {
			return ResponseClass.SUCCESS;
		}
		else if (statusCode >= 300 && statusCode <= 399) {
			return ResponseClass.REDIRECT;
		}
		else if (statusCode >= 400 && statusCode <= 499) {
			return ResponseClass.CLIENT_ERROR;
		}
		else if (statusCode >= 500 && statusCode <= 599) {
			return ResponseClass.SERVER_ERROR;
		}
		else if (statusCode >= 600 && statusCode <= 699) {
			return ResponseClass.GLOBAL_ERROR;
		}
		else {
			return ResponseClass.UNKNOWN;
		}
	}

	public static boolean isFinal(int statusCode) {
		return statusCode >= 200;
	}

	public static boolean isChallenge(int statusCode) {
		return statusCode == Response.UNAUTHORIZED
				|| statusCode == Response.PROXY_AUTHENTICATION_REQUIRED;
	}

}
