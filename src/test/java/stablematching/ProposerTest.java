package stablematching;

import java.util.List;

import org.junit.*;
import static org.junit.Assert.*;

import stablematching.Messages.Accept;
import stablematching.Messages.Breakup;
import stablematching.Messages.EngagedNotify;
import stablematching.Messages.Proposal;
import stablematching.Messages.Reject;
import stablematching.Messages.Terminate;

public class ProposerTest {
	private RecordingChannel channel;
	private Proposer proposer;

	@Before
	public void setUp() {
		channel = new RecordingChannel();
		proposer = new Proposer(0, new PreferenceTable(ProcessAddress.proposer(0), new int[] {2, 0, 1}), channel);
	}

	private void assertProposedTo(int acceptor) {
		List<RecordingChannel.Sent> sent = channel.drain();
		assertEquals(sent.toString(), 1, sent.size());
		assertEquals(ProcessAddress.acceptor(acceptor), sent.get(0).to);
		assertTrue(sent.get(0).message instanceof Proposal);
		assertEquals(0, ((Proposal) sent.get(0).message).proposerId);
	}

	@Test
	public void proposesToMostPreferredFirst() {
		proposer.start();
		assertProposedTo(2);
		assertEquals(Proposer.Status.AWAITING_RESPONSE, proposer.status());
		assertEquals(1, proposer.proposalsSent());
	}

	@Test
	public void acceptEngages() {
		proposer.start();
		channel.drain();
		proposer.receive(new Accept(2));
		assertEquals(Proposer.Status.ENGAGED, proposer.status());
		assertEquals(2, proposer.partner());
		assertTrue(channel.sent.isEmpty());
	}

	@Test
	public void rejectMovesToNextCandidate() {
		proposer.start();
		channel.drain();
		proposer.receive(new Reject(2));
		assertProposedTo(0);
		proposer.receive(new Reject(0));
		assertProposedTo(1);
		assertEquals(2, proposer.cursor());
		assertEquals(3, proposer.proposalsSent());
	}

	@Test
	public void breakupMovesPastTheDumpingAcceptor() {
		proposer.start();
		proposer.receive(new Accept(2));
		channel.drain();

		proposer.receive(new Breakup(2));
		assertProposedTo(0);
		assertEquals(Proposer.NONE, proposer.partner());
		assertEquals(1, proposer.cursor());
	}

	@Test
	public void staleBreakupDoesNotDisturbPendingProposal() {
		proposer.start();
		proposer.receive(new Reject(2));
		channel.drain();

		//waiting on acceptor-0, a breakup from someone else slips in first
		proposer.receive(new Breakup(1));
		assertTrue(channel.sent.isEmpty());
		assertEquals(Proposer.Status.AWAITING_RESPONSE, proposer.status());

		proposer.receive(new Accept(0));
		assertEquals(Proposer.Status.ENGAGED, proposer.status());
		assertEquals(0, proposer.partner());
		assertEquals(1, proposer.cursor());
	}

	@Test
	public void neverProposesTwiceToTheSameAcceptor() {
		proposer.start();
		proposer.receive(new Accept(2));
		proposer.receive(new Breakup(2));
		proposer.receive(new Accept(0));
		proposer.receive(new Breakup(0));
		List<RecordingChannel.Sent> sent = channel.drain();
		assertEquals(3, sent.size());
		assertEquals(ProcessAddress.acceptor(2), sent.get(0).to);
		assertEquals(ProcessAddress.acceptor(0), sent.get(1).to);
		assertEquals(ProcessAddress.acceptor(1), sent.get(2).to);
	}

	@Test
	public void exhaustingTheListIsAViolation() {
		proposer.start();
		proposer.receive(new Reject(2));
		proposer.receive(new Reject(0));
		try {
			proposer.receive(new Reject(1));
			fail();
		} catch (ProtocolViolationException e) {
			assertEquals(ProcessAddress.proposer(0), e.getProcess());
			assertTrue(e.getMessage(), e.getMessage().contains("exhausted"));
		}
	}

	@Test(expected = ProtocolViolationException.class)
	public void responseFromWrongAcceptorIsAViolation() {
		proposer.start();
		proposer.receive(new Accept(1));
	}

	@Test(expected = ProtocolViolationException.class)
	public void acceptWhileEngagedIsAViolation() {
		proposer.start();
		proposer.receive(new Accept(2));
		proposer.receive(new Accept(2));
	}

	@Test(expected = ProtocolViolationException.class)
	public void breakupFromNonPartnerWhileEngagedIsAViolation() {
		proposer.start();
		proposer.receive(new Accept(2));
		proposer.receive(new Breakup(1));
	}

	@Test(expected = ProtocolViolationException.class)
	public void engagedNotifyIsNotForProposers() {
		proposer.start();
		proposer.receive(new EngagedNotify(2));
	}

	@Test(expected = ProtocolViolationException.class)
	public void startingTwiceIsAViolation() {
		proposer.start();
		proposer.start();
	}

	@Test
	public void terminateFreezes() {
		proposer.start();
		proposer.receive(new Accept(2));
		proposer.receive(new Terminate());
		assertEquals(Proposer.Status.TERMINATED, proposer.status());

		proposer.receive(new Breakup(2));
		assertEquals(2, proposer.partner());
		assertEquals(1, channel.sent.size());
	}

	@Test
	public void terminateWhileAwaitingWaitsForTheAccept() {
		proposer.start();
		proposer.receive(new Terminate());
		assertEquals(Proposer.Status.AWAITING_RESPONSE, proposer.status());

		proposer.receive(new Accept(2));
		assertEquals(Proposer.Status.TERMINATED, proposer.status());
		assertEquals(2, proposer.partner());
	}
}
