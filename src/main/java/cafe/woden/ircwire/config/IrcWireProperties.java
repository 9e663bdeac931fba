package cafe.woden.ircwire.config;

import cafe.woden.ircwire.casemap.CaseMapping;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * ircwire configuration, stored under {@code ircwire}.
 *
 * <p>{@code casemapping} is an ISUPPORT token ({@code ascii}, {@code rfc1459},
 * {@code rfc1459-strict}); blank or unknown values fall back to {@code rfc1459}.
 *
 * <p>{@code parser.rejectParameterOverflow} turns the default folding of parameters beyond the
 * fourteenth into a parse error, which conformance harnesses may want.
 */
@ConfigurationProperties(prefix = "ircwire")
public record IrcWireProperties(String casemapping, Parser parser) {

  public static final CaseMapping DEFAULT_CASEMAPPING = CaseMapping.RFC1459;

  public IrcWireProperties {
    if (casemapping == null || casemapping.isBlank()) casemapping = DEFAULT_CASEMAPPING.token();
    if (parser == null) parser = new Parser(null);
  }

  public record Parser(Boolean rejectParameterOverflow) {
    public Parser {
      if (rejectParameterOverflow == null) rejectParameterOverflow = false;
    }
  }

  public CaseMapping resolvedCaseMapping() {
    return CaseMapping.fromToken(casemapping).orElse(DEFAULT_CASEMAPPING);
  }
}
