package stablematching;

import akka.actor.Props;
import stablematching.Messages.FinalPartner;
import stablematching.Messages.ProtocolMessage;
import stablematching.Messages.Start;

/**
 * ProposerActor runs one Proposer. Proposals go out once a Start arrives; every
 * protocol message, whatever its type or sender, comes through the one mailbox and
 * is handed to the state machine in arrival order.
 */
public class ProposerActor extends ProcessActor {
	private final PreferenceTable preferences;
	private Proposer proposer;

	public ProposerActor(int id, PreferenceTable preferences) {
		super(ProcessAddress.proposer(id));
		this.preferences = preferences;
	}

	public static Props props(int id, PreferenceTable preferences) {
		return Props.create(ProposerActor.class, () -> new ProposerActor(id, preferences));
	}

	@Override
	protected void setup(Channel channel) {
		this.proposer = new Proposer(address.index(), preferences, channel);
	}

	@Override
	protected Receive running() {
		return receiveBuilder()
				.match(Start.class, start -> proposer.start())
				.match(ProtocolMessage.class, this::onProtocolMessage)
				.build();
	}

	private void onProtocolMessage(ProtocolMessage message) {
		proposer.receive(message);
		if (proposer.status() == Proposer.Status.TERMINATED) {
			log.info("{} terminating, final partner acceptor-{} after {} proposals",
					address, proposer.partner(), proposer.proposalsSent());
			session.tell(new FinalPartner(address, proposer.partner(), proposer.proposalsSent()), getSelf());
			getContext().become(frozen());
		}
	}
}
