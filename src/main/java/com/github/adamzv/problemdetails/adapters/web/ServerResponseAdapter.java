package com.github.adamzv.problemdetails.adapters.web;

import com.github.adamzv.problemdetails.domain.RenderedProblem;
import com.github.adamzv.problemdetails.ports.ResponseAdapter;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.function.ServerResponse;

/**
 * Spring MVC functional endpoints ({@code RouterFunction} handlers).
 */
public class ServerResponseAdapter implements ResponseAdapter<ServerResponse> {

  @Override
  public ServerResponse adapt(RenderedProblem rendered) {
    return ServerResponse
        .status(rendered.status())
        .contentType(MediaType.parseMediaType(rendered.contentType()))
        .contentLength(rendered.body().length)
        .body(rendered.body());
  }
}
