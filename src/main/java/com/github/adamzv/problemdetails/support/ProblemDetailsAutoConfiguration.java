package com.github.adamzv.problemdetails.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.adamzv.problemdetails.adapters.json.JsonProblemCodec;
import com.github.adamzv.problemdetails.adapters.web.ProblemDetailsExceptionHandler;
import com.github.adamzv.problemdetails.adapters.web.ResponseEntityAdapter;
import com.github.adamzv.problemdetails.adapters.web.ServerResponseAdapter;
import com.github.adamzv.problemdetails.adapters.xml.XmlProblemCodec;
import com.github.adamzv.problemdetails.application.ContentNegotiator;
import com.github.adamzv.problemdetails.application.ProblemRenderer;
import com.github.adamzv.problemdetails.ports.ProblemCodec;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the enabled codecs into a {@link ContentNegotiator} and exposes the web adapters.
 * Codec beans exist only for formats switched on under {@code problem-details.formats}, so
 * the negotiator's formats are fixed when the context starts.
 */
@AutoConfiguration(after = JacksonAutoConfiguration.class)
@EnableConfigurationProperties(ProblemDetailsProperties.class)
public class ProblemDetailsAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "problem-details.formats", name = "json", havingValue = "true",
      matchIfMissing = true)
  public JsonProblemCodec jsonProblemCodec(ObjectProvider<ObjectMapper> objectMapper) {
    return new JsonProblemCodec(objectMapper.getIfAvailable(ObjectMapper::new));
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "problem-details.formats", name = "xml", havingValue = "true")
  public XmlProblemCodec xmlProblemCodec() {
    return new XmlProblemCodec();
  }

  @Bean
  @ConditionalOnMissingBean
  public ContentNegotiator problemContentNegotiator(ObjectProvider<ProblemCodec> codecs) {
    return new ContentNegotiator(codecs.orderedStream().toList());
  }

  @Bean
  @ConditionalOnMissingBean
  public ProblemRenderer problemRenderer(ContentNegotiator negotiator, ProblemDetailsProperties properties) {
    return new ProblemRenderer(negotiator, properties.fallbackStatus());
  }

  @Bean
  public ProblemDetailsStartupLogger problemDetailsStartupLogger(ContentNegotiator negotiator,
      ProblemDetailsProperties properties) {
    return new ProblemDetailsStartupLogger(negotiator, properties);
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnClass(name = "org.springframework.http.ResponseEntity")
  static class ResponseEntityConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ResponseEntityAdapter problemResponseEntityAdapter() {
      return new ResponseEntityAdapter();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    public ProblemDetailsExceptionHandler problemDetailsExceptionHandler(
        ProblemRenderer renderer,
        ResponseEntityAdapter adapter,
        ObjectProvider<MeterRegistry> meterRegistry) {
      return new ProblemDetailsExceptionHandler(renderer, adapter, meterRegistry.getIfAvailable());
    }
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnClass(name = "org.springframework.web.servlet.function.ServerResponse")
  static class ServerResponseConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ServerResponseAdapter problemServerResponseAdapter() {
      return new ServerResponseAdapter();
    }
  }
}
