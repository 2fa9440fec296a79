package stablematching;

import akka.actor.Props;
import stablematching.Messages.ProtocolMessage;

/**
 * CoordinatorActor runs the TerminationCoordinator of a run.
 */
public class CoordinatorActor extends ProcessActor {
	private final int size;
	private TerminationCoordinator coordinator;

	public CoordinatorActor(int size) {
		super(ProcessAddress.COORDINATOR);
		this.size = size;
	}

	public static Props props(int size) {
		return Props.create(CoordinatorActor.class, () -> new CoordinatorActor(size));
	}

	@Override
	protected void setup(Channel channel) {
		this.coordinator = new TerminationCoordinator(size, channel);
		log.info("{} started, waiting for {} engagements", address, size);
	}

	@Override
	protected Receive running() {
		return receiveBuilder()
				.match(ProtocolMessage.class, this::onProtocolMessage)
				.build();
	}

	private void onProtocolMessage(ProtocolMessage message) {
		coordinator.receive(message);
		log.debug("{}: {} of {} acceptors engaged", address, coordinator.engagedCount(), size);
		if (coordinator.isTerminated()) {
			log.info("{}: all {} acceptors engaged, TERMINATE broadcast", address, size);
			getContext().become(frozen());
		}
	}
}
