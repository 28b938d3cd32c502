package org.github.sipline.transaction;

import javax.sip.message.Message;

public interface MessageSender {

	/**
	 * @return false when the transport refused the message.
	 */
	boolean send(Message message);

}
