/*
 * Stable Matching - one run of the protocol
 *
 * Solution Description:
 * The session owns every process of a run as its child actors and walks through these steps:
 *	Step 0: create the coordinator, the n acceptors and the n proposers
 *	Step 1: send every process a Setup with the address book and wait for 2n+1 Ready replies,
 *			so no process can receive protocol traffic before it knows its peers
 *	Step 2: Start the proposers; from here on the processes only talk to each other
 *	Step 3: on TERMINATE every proposer and acceptor reports its final partner back here
 *	Step 4: check that both sides agree on one bijection and answer the requester
 * If any process fails, or stops before reporting, the run is aborted: the requester gets
 * a Status.Failure with the cause and no matching.
 */
package stablematching;

import java.time.Duration;
import java.util.Arrays;

import akka.actor.AbstractActor;
import akka.actor.ActorRef;
import akka.actor.OneForOneStrategy;
import akka.actor.Props;
import akka.actor.Status;
import akka.actor.SupervisorStrategy;
import akka.actor.Terminated;
import akka.event.Logging;
import akka.event.LoggingAdapter;
import akka.japi.pf.DeciderBuilder;
import stablematching.Messages.FinalPartner;
import stablematching.Messages.Ready;
import stablematching.Messages.Setup;
import stablematching.Messages.Solve;
import stablematching.Messages.Start;

public class MatchingSession extends AbstractActor {
	private final LoggingAdapter log = Logging.getLogger(getContext().getSystem(), this);

	private final Preferences preferences;
	private final int size;

	private ActorRef requester;
	private ActorRef[] proposers;
	private int ready;
	private final int[] proposerPartners;
	private final int[] acceptorPartners;
	private int reports;
	private int proposals;
	//first failure reported by a child, if any
	private StableMatchingException failure;
	private boolean finished;

	public MatchingSession(Preferences preferences) {
		this.preferences = preferences;
		this.size = preferences.size();
		this.proposerPartners = new int[size];
		this.acceptorPartners = new int[size];
		Arrays.fill(proposerPartners, -1);
		Arrays.fill(acceptorPartners, -1);
	}

	public static Props props(Preferences preferences) {
		return Props.create(MatchingSession.class, () -> new MatchingSession(preferences));
	}

	/*
	 * A failed process is never restarted, its state is gone and the run cannot be
	 * trusted any more. Stop it and keep the cause, the Terminated that follows
	 * aborts the run.
	 */
	@Override
	public SupervisorStrategy supervisorStrategy() {
		return new OneForOneStrategy(0, Duration.ofMinutes(1), DeciderBuilder
				.match(StableMatchingException.class, e -> {
					recordFailure(e);
					return SupervisorStrategy.stop();
				})
				.matchAny(e -> {
					recordFailure(new CommunicationFailureException("process failed: " + e, e));
					return SupervisorStrategy.stop();
				})
				.build());
	}

	private void recordFailure(StableMatchingException e) {
		if (failure == null) {
			failure = e;
		}
	}

	@Override
	public Receive createReceive() {
		return receiveBuilder()
				.match(Solve.class, this::onSolve)
				.build();
	}

	private void onSolve(Solve solve) {
		this.requester = getSender();
		String run = getSelf().path().name();
		log.info("run {}: starting with {} proposers and {} acceptors", run, size, size);

		//Step 0: create all the processes
		ActorRef coordinator = spawn(CoordinatorActor.props(size), ProcessAddress.COORDINATOR);
		ActorRef[] acceptors = new ActorRef[size];
		this.proposers = new ActorRef[size];
		for (int i = 0; i < size; i++) {
			acceptors[i] = spawn(AcceptorActor.props(i, preferences.acceptor(i)), ProcessAddress.acceptor(i));
			proposers[i] = spawn(ProposerActor.props(i, preferences.proposer(i)), ProcessAddress.proposer(i));
		}

		//Step 1: hand out the address book
		Setup setup = new Setup(new Peers(run, proposers, acceptors, coordinator));
		coordinator.tell(setup, getSelf());
		for (int i = 0; i < size; i++) {
			acceptors[i].tell(setup, getSelf());
			proposers[i].tell(setup, getSelf());
		}
		getContext().become(settingUp());
	}

	private ActorRef spawn(Props props, ProcessAddress address) {
		ActorRef ref = getContext().actorOf(props, address.toString());
		getContext().watch(ref);
		return ref;
	}

	private Receive settingUp() {
		return receiveBuilder()
				.match(Ready.class, this::onReady)
				.match(Terminated.class, this::onTerminated)
				.build();
	}

	private void onReady(Ready r) {
		ready++;
		if (ready == 2 * size + 1) {
			//Step 2: everyone knows their peers, let the proposers go
			log.debug("run {}: all {} processes ready", getSelf().path().name(), ready);
			getContext().become(running());
			for (ActorRef proposer : proposers) {
				proposer.tell(new Start(), getSelf());
			}
		}
	}

	private Receive running() {
		return receiveBuilder()
				.match(FinalPartner.class, this::onFinalPartner)
				.match(Terminated.class, this::onTerminated)
				.build();
	}

	//Step 3: collect the final partners
	private void onFinalPartner(FinalPartner report) {
		if (report.process.role() == Role.PROPOSER) {
			proposerPartners[report.process.index()] = report.partner;
			proposals += report.proposalsSent;
		} else {
			acceptorPartners[report.process.index()] = report.partner;
		}
		reports++;
		if (reports == 2 * size) {
			complete();
		}
	}

	//Step 4: check both views agree and answer
	private void complete() {
		String run = getSelf().path().name();
		Matching matching;
		try {
			matching = Matching.fromPartners(proposerPartners, acceptorPartners);
		} catch (ProtocolViolationException e) {
			abort(e);
			return;
		}
		log.info("run {}: complete after {} proposals", run, proposals);
		finished = true;
		requester.tell(new MatchingResult(run, matching, proposals), getSelf());
		getContext().stop(getSelf());
	}

	private void onTerminated(Terminated t) {
		if (finished) {
			return;
		}
		if (failure != null) {
			abort(failure);
		} else {
			abort(new CommunicationFailureException(t.getActor().path().name() + " stopped before the run completed"));
		}
	}

	private void abort(StableMatchingException cause) {
		log.error(cause, "run {} aborted: {}", getSelf().path().name(), cause.getMessage());
		finished = true;
		requester.tell(new Status.Failure(cause), getSelf());
		getContext().stop(getSelf());
	}
}
