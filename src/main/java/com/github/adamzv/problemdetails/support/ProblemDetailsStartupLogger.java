package com.github.adamzv.problemdetails.support;

import com.github.adamzv.problemdetails.application.ContentNegotiator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;

public class ProblemDetailsStartupLogger implements ApplicationListener<ApplicationReadyEvent> {

  private static final Logger log = LoggerFactory.getLogger(ProblemDetailsStartupLogger.class);

  private final ContentNegotiator negotiator;
  private final ProblemDetailsProperties properties;

  public ProblemDetailsStartupLogger(ContentNegotiator negotiator, ProblemDetailsProperties properties) {
    this.negotiator = negotiator;
    this.properties = properties;
  }

  @Override
  public void onApplicationEvent(ApplicationReadyEvent event) {
    log.info(
        "problem_details_ready formats={} defaultContentType={} fallbackStatus={}",
        negotiator.formats(),
        negotiator.defaultCodec().contentType(),
        properties.fallbackStatus()
    );
  }
}
