package com.wxradar.api.api;

import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

/** Landing and help pages, plus the 403 answer for every path the API does not serve. */
@RestController
public class StaticPageController {
  private static final Resource INDEX = new ClassPathResource("pages/index.html");
  private static final Resource HELP = new ClassPathResource("pages/help.html");

  @GetMapping("/")
  public ResponseEntity<Resource> index() {
    return html(INDEX);
  }

  @GetMapping({"/help", "/help/"})
  public ResponseEntity<Resource> help() {
    return html(HELP);
  }

  @RequestMapping(path = "/**", method = {RequestMethod.GET, RequestMethod.HEAD})
  public ResponseEntity<Resource> other() {
    throw new ForbiddenException("path not served");
  }

  private static ResponseEntity<Resource> html(Resource page) {
    return ResponseEntity.ok().contentType(MediaType.TEXT_HTML).body(page);
  }
}
