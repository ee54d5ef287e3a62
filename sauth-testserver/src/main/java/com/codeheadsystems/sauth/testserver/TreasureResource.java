package com.codeheadsystems.sauth.testserver;

import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

/**
 * Protected endpoint. Call {@code GET /api/treasure} with Basic credentials once, then
 * again with only the returned {@code session} cookie to see the cookie cache at work.
 */
@Path("/api/treasure")
@Produces(MediaType.TEXT_PLAIN)
public class TreasureResource {

  /**
   * Returns a fixed body; reaching it at all means the request was authenticated.
   *
   * @return the treasure
   */
  @GET
  public String treasure() {
    return "treasure";
  }
}
