package stablematching;

import stablematching.Messages.ProtocolMessage;

/**
 * Outbound side of a process's links to its peers. Delivery is reliable, and messages
 * sent to the same address arrive in the order they were sent. Nothing is promised
 * about the relative order of messages from different senders.
 */
public interface Channel {

	/**
	 * Sends a message to the process at the given address.
	 *
	 * @throws CommunicationFailureException if the address cannot be resolved
	 */
	void send(ProcessAddress to, ProtocolMessage message);
}
