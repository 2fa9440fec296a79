package stablematching;

import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import akka.actor.ActorRef;
import akka.actor.ActorSystem;
import akka.pattern.AskTimeoutException;
import akka.pattern.Patterns;
import stablematching.Messages.Solve;

/**
 * Entry point for running the protocol on an actor system. Every call gets its own
 * MatchingSession, so runs on the same system do not share any process.
 */
public final class StableMatching {
	private final ActorSystem system;
	private final MatchingSettings settings;
	private final AtomicInteger runs = new AtomicInteger();

	public StableMatching(ActorSystem system, MatchingSettings settings) {
		this.system = system;
		this.settings = settings;
	}

	public StableMatching(ActorSystem system) {
		this(system, new MatchingSettings(system.settings().config()));
	}

	/**
	 * Starts a run, the stage completes with the result or with the
	 * StableMatchingException that aborted the run. A run that fails or times out
	 * is stopped together with all its processes.
	 */
	public CompletionStage<MatchingResult> solveAsync(Preferences preferences) {
		ActorRef session = system.actorOf(MatchingSession.props(preferences), "matching-" + runs.incrementAndGet());
		CompletionStage<Object> reply = Patterns.ask(session, new Solve(), settings.runTimeout());
		reply.whenComplete((result, failure) -> {
			if (failure != null) {
				system.stop(session);
			}
		});
		return reply.thenApply(MatchingResult.class::cast);
	}

	/**
	 * Runs the protocol and waits at most the configured run-timeout for it.
	 *
	 * @throws StableMatchingException if the run was aborted or did not finish in time
	 */
	public MatchingResult solve(Preferences preferences) {
		try {
			return solveAsync(preferences).toCompletableFuture().get();
		} catch (ExecutionException e) {
			Throwable cause = e.getCause();
			while (cause instanceof CompletionException && cause.getCause() != null) {
				cause = cause.getCause();
			}
			if (cause instanceof StableMatchingException) {
				throw (StableMatchingException) cause;
			}
			if (cause instanceof AskTimeoutException) {
				throw new CommunicationFailureException("no result within " + settings.runTimeout(), cause);
			}
			throw new CommunicationFailureException("run failed: " + cause, cause);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new CommunicationFailureException("interrupted while waiting for the run", e);
		}
	}
}
