package ca.gc.cra.meshradar.domain.msg;

import ca.gc.cra.meshradar.domain.mesh.MessageKind;
import java.util.List;

/**
 * Route discovery payload of a traceroute request or reply.
 *
 * @param route hops towards the target
 * @param snrTowards SNR in dB per forward hop ({@code NaN} when unknown)
 * @param routeBack hops on the way back
 * @param snrBack SNR in dB per return hop
 */
public record PathTrace(List<Long> route, List<Double> snrTowards, List<Long> routeBack, List<Double> snrBack)
    implements NormalizedRecord {

  public PathTrace {
    route = List.copyOf(route);
    snrTowards = List.copyOf(snrTowards);
    routeBack = List.copyOf(routeBack);
    snrBack = List.copyOf(snrBack);
  }

  @Override
  public MessageKind kind() {
    return MessageKind.TRACEROUTE;
  }
}
