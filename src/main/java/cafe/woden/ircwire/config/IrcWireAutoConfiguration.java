package cafe.woden.ircwire.config;

import cafe.woden.ircwire.casemap.CaseMapping;
import cafe.woden.ircwire.message.IrcMessageParser;
import cafe.woden.ircwire.message.IrcMessageSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Exposes the parser, serializer and network casemapping as beans for Spring Boot applications.
 *
 * <p>Each bean backs off when the application defines its own.
 */
@AutoConfiguration
@EnableConfigurationProperties(IrcWireProperties.class)
public class IrcWireAutoConfiguration {

  private static final Logger log = LoggerFactory.getLogger(IrcWireAutoConfiguration.class);

  @Bean
  @ConditionalOnMissingBean
  public IrcMessageParser ircMessageParser(IrcWireProperties props) {
    boolean reject = props.parser().rejectParameterOverflow();
    log.debug("[ircwire] Parser rejectParameterOverflow={}", reject);
    return reject ? new IrcMessageParser(true) : IrcMessageParser.lenient();
  }

  @Bean
  @ConditionalOnMissingBean
  public IrcMessageSerializer ircMessageSerializer() {
    return IrcMessageSerializer.instance();
  }

  @Bean
  @ConditionalOnMissingBean
  public CaseMapping ircCaseMapping(IrcWireProperties props) {
    CaseMapping mapping = props.resolvedCaseMapping();
    if (CaseMapping.fromToken(props.casemapping()).isEmpty()) {
      log.warn(
          "[ircwire] Unknown casemapping '{}', falling back to {}",
          props.casemapping(),
          mapping.token());
    }
    log.debug("[ircwire] Using casemapping {}", mapping.token());
    return mapping;
  }
}
