package org.github.sipline.messages;

import java.util.Iterator;
import java.util.Vector;

import javax.sdp.Attribute;
import javax.sdp.MediaDescription;
import javax.sdp.Origin;
import javax.sdp.SdpException;
import javax.sdp.SdpFactory;
import javax.sdp.SessionDescription;

import org.github.sipline.exceptions.SiplineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Media direction rewriting for hold and resume re-INVITEs.
 */
public final class SessionDescriptions {

	public static final String SENDRECV = "sendrecv";
	public static final String SENDONLY = "sendonly";
	public static final String RECVONLY = "recvonly";
	public static final String INACTIVE = "inactive";

	private static final Logger logger = LoggerFactory.getLogger(SessionDescriptions.class);

	private SessionDescriptions() {}

	/**
	 * Returns {@code sdp} with every media direction replaced by {@code direction}
	 * and the origin session version incremented.
	 */
	@SuppressWarnings("unchecked")
	public static String withDirection(String sdp, String direction) {
		SdpFactory sdpFactory = SdpFactory.getInstance();
		try {
			SessionDescription description = sdpFactory.createSessionDescription(sdp);
			removeDirections(description.getAttributes(false));
			Vector<MediaDescription> media = description.getMediaDescriptions(false);
			if (media == null || media.isEmpty()) {
				Vector<Attribute> attributes = description.getAttributes(true);
				attributes.add(sdpFactory.createAttribute(direction, null));
			}
			else {
				for (MediaDescription mediaDescription : media) {
					Vector<Attribute> attributes = mediaDescription.getAttributes(true);
					removeDirections(attributes);
					attributes.add(sdpFactory.createAttribute(direction, null));
				}
			}
			Origin origin = description.getOrigin();
			if (origin != null) {
				origin.setSessionVersion(origin.getSessionVersion() + 1);
			}
			return description.toString();
		} catch (SdpException sdpException) {
			logger.error("Could not rewrite session description to {}.", direction, sdpException);
			throw new SiplineException("Invalid session description.", sdpException);
		}
	}

	/**
	 * Direction declared by the first media section, or the session level, or sendrecv.
	 */
	@SuppressWarnings("unchecked")
	public static String directionOf(String sdp) {
		try {
			SessionDescription description = SdpFactory.getInstance().createSessionDescription(sdp);
			Vector<MediaDescription> media = description.getMediaDescriptions(false);
			if (media != null && !media.isEmpty()) {
				String direction = findDirection(media.get(0).getAttributes(false));
				if (direction != null) {
					return direction;
				}
			}
			String direction = findDirection(description.getAttributes(false));
			return direction == null ? SENDRECV : direction;
		} catch (SdpException sdpException) {
			logger.warn("Could not read direction of session description.", sdpException);
			return SENDRECV;
		}
	}

	private static String findDirection(Vector<Attribute> attributes) throws SdpException {
		if (attributes == null) {
			return null;
		}
		for (Attribute attribute : attributes) {
			if (isDirection(attribute.getName())) {
				return attribute.getName();
			}
		}
		return null;
	}

	private static void removeDirections(Vector<Attribute> attributes) throws SdpException {
		if (attributes == null) {
			return;
		}
		Iterator<Attribute> iterator = attributes.iterator();
		while (iterator.hasNext()) {
			if (isDirection(iterator.next().getName())) {
				iterator.remove();
			}
		}
	}

	private static boolean isDirection(String name) {
		return SENDRECV.equals(name) || SENDONLY.equals(name)
				|| RECVONLY.equals(name) || INACTIVE.equals(name);
	}

}
