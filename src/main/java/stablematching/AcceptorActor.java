package stablematching;

import akka.actor.Props;
import stablematching.Messages.FinalPartner;
import stablematching.Messages.ProtocolMessage;

/**
 * AcceptorActor runs one Acceptor, it only ever reacts to proposals.
 */
public class AcceptorActor extends ProcessActor {
	private final PreferenceTable preferences;
	private Acceptor acceptor;

	public AcceptorActor(int id, PreferenceTable preferences) {
		super(ProcessAddress.acceptor(id));
		this.preferences = preferences;
	}

	public static Props props(int id, PreferenceTable preferences) {
		return Props.create(AcceptorActor.class, () -> new AcceptorActor(id, preferences));
	}

	@Override
	protected void setup(Channel channel) {
		this.acceptor = new Acceptor(address.index(), preferences, channel);
	}

	@Override
	protected Receive running() {
		return receiveBuilder()
				.match(ProtocolMessage.class, this::onProtocolMessage)
				.build();
	}

	private void onProtocolMessage(ProtocolMessage message) {
		acceptor.receive(message);
		if (acceptor.status() == Acceptor.Status.TERMINATED) {
			log.info("{} is finally engaged to proposer-{}, terminating", address, acceptor.partner());
			session.tell(new FinalPartner(address, acceptor.partner(), 0), getSelf());
			getContext().become(frozen());
		}
	}
}
