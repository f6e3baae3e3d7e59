package ca.gc.cra.meshradar.domain.mesh;

import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Reconstructed hop sequences of one traceroute exchange.
 * <p><strong>Invariant:</strong> Keyed by {@code (packetId, fromNodeId)} of the request. Routes only ever grow; a
 * return route is attached next to the forward route and never replaces it.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param packetId id of the traceroute request
 * @param fromNodeId node that issued the request
 * @param toNodeId node being traced
 * @param route intermediate hops from requester towards target
 * @param snrTowards per-hop SNR in dB along {@code route} ({@code NaN} when unknown)
 * @param routeBack intermediate hops on the way back; empty when not yet known
 * @param snrBack per-hop SNR in dB along {@code routeBack}
 * @param done whether a reply has been seen
 * @param gatewayId gateway that first reported the exchange
 * @param importTime first local receive time in epoch milliseconds
 * @since 0.1.0
 */
public record Traceroute(
    long packetId,
    long fromNodeId,
    long toNodeId,
    List<Long> route,
    List<Double> snrTowards,
    List<Long> routeBack,
    List<Double> snrBack,
    boolean done,
    String gatewayId,
    long importTime) {

  /**
   * Copies the hop lists.
   */
  public Traceroute {
    route = List.copyOf(Objects.requireNonNull(route, "route"));
    snrTowards = List.copyOf(Objects.requireNonNull(snrTowards, "snrTowards"));
    routeBack = List.copyOf(Objects.requireNonNull(routeBack, "routeBack"));
    snrBack = List.copyOf(Objects.requireNonNull(snrBack, "snrBack"));
    Objects.requireNonNull(gatewayId, "gatewayId");
  }

  public PacketKey key() {
    return new PacketKey(packetId, fromNodeId);
  }

  /**
   * Whether a return route is known.
   *
   * @return {@code true} when {@link #routeBack()} is non-empty
   */
  public boolean hasRouteBack() {
    return !routeBack.isEmpty();
  }

  /**
   * Folds a new sighting into an existing record.
   *
   * @param existing stored record, or {@code null} when none exists
   * @param incoming record built from the new sighting; must share the key of {@code existing}
   * @return merged record and what happened
   */
  public static Merge merge(Traceroute existing, Traceroute incoming) {
    Objects.requireNonNull(incoming, "incoming");
    if (existing == null) {
      return new Merge(incoming, MergeOutcome.CREATED);
    }
    if (!existing.key().equals(incoming.key())) {
      throw new IllegalArgumentException("Cannot merge traceroutes " + existing.key() + " and " + incoming.key());
    }
    RouteChoice forward = choose(existing.route, existing.snrTowards, incoming.route, incoming.snrTowards);
    RouteChoice back = choose(existing.routeBack, existing.snrBack, incoming.routeBack, incoming.snrBack);
    boolean done = existing.done || incoming.done;

    Traceroute merged = new Traceroute(
        existing.packetId,
        existing.fromNodeId,
        existing.toNodeId,
        forward.route,
        forward.snr,
        back.route,
        back.snr,
        done,
        existing.gatewayId,
        existing.importTime);

    MergeOutcome outcome;
    if (forward.outcome == MergeOutcome.CONFLICT || back.outcome == MergeOutcome.CONFLICT) {
      outcome = MergeOutcome.CONFLICT;
    } else if (forward.outcome == MergeOutcome.EXTENDED
        || back.outcome == MergeOutcome.EXTENDED
        || done != existing.done) {
      outcome = MergeOutcome.EXTENDED;
    } else {
      outcome = MergeOutcome.UNCHANGED;
    }
    return new Merge(merged, outcome);
  }

  private static RouteChoice choose(
      List<Long> stored, List<Double> storedSnr, List<Long> offered, List<Double> offeredSnr) {
    if (isPrefix(offered, stored)) {
      List<Double> snr = offered.size() == stored.size() && offeredSnr.size() > storedSnr.size()
          ? offeredSnr
          : storedSnr;
      return new RouteChoice(stored, snr, MergeOutcome.UNCHANGED);
    }
    if (isPrefix(stored, offered)) {
      return new RouteChoice(offered, offeredSnr, MergeOutcome.EXTENDED);
    }
    return new RouteChoice(stored, storedSnr, MergeOutcome.CONFLICT);
  }

  private static boolean isPrefix(List<Long> prefix, List<Long> of) {
    return prefix.size() <= of.size() && of.subList(0, prefix.size()).equals(prefix);
  }

  /**
   * Merge result.
   *
   * @param traceroute record to store
   * @param outcome what the merge did
   */
  public record Merge(Traceroute traceroute, MergeOutcome outcome) {}

  private record RouteChoice(List<Long> route, List<Double> snr, MergeOutcome outcome) {}
}
