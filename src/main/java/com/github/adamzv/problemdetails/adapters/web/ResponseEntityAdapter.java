package com.github.adamzv.problemdetails.adapters.web;

import com.github.adamzv.problemdetails.domain.RenderedProblem;
import com.github.adamzv.problemdetails.ports.ResponseAdapter;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

/**
 * Spring MVC / WebFlux annotated controllers.
 */
public class ResponseEntityAdapter implements ResponseAdapter<ResponseEntity<byte[]>> {

  @Override
  public ResponseEntity<byte[]> adapt(RenderedProblem rendered) {
    return ResponseEntity
        .status(rendered.status())
        .contentType(MediaType.parseMediaType(rendered.contentType()))
        .contentLength(rendered.body().length)
        .body(rendered.body());
  }
}
