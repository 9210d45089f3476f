// Copyright 2011 Google Inc.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//      http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.google.enterprise.gitauthz.servlets;

import com.google.common.base.Preconditions;
import com.google.enterprise.gitauthz.gate.Gate;
import com.google.enterprise.gitauthz.gate.GateOutcome;
import com.google.enterprise.gitauthz.gate.GatedAction;
import com.google.enterprise.gitauthz.gate.GatedFormAction;
import com.google.enterprise.gitauthz.lookup.LookupException;
import com.google.enterprise.gitauthz.policy.RequestContext;

import org.joda.time.DateTimeUtils;
import org.joda.time.DateTimeZone;
import org.joda.time.format.DateTimeFormat;
import org.joda.time.format.DateTimeFormatter;

import java.io.IOException;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.annotation.Nullable;
import javax.servlet.http.HttpServlet;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;

/**
 * Base class for servlets whose handlers are guarded by a {@link Gate}.
 * Denials become 401 or 404 error responses; a failed lookup becomes a 500,
 * never a denial.
 */
public abstract class GatedServlet extends HttpServlet {
  private static final Logger logger = Logger.getLogger(GatedServlet.class.getName());

  private static final DateTimeFormatter HTTP_DATE_FORMAT =
      DateTimeFormat.forPattern("EEE, dd MMM yyyy HH:mm:ss 'GMT'")
      .withZone(DateTimeZone.UTC)
      .withLocale(Locale.US);

  private final Gate gate;

  protected GatedServlet(Gate gate) {
    this.gate = Preconditions.checkNotNull(gate);
  }

  protected Gate getGate() {
    return gate;
  }

  /**
   * Runs a gated action for a request.  On denial an error response has
   * been sent.  When a lookup fails a 500 has been sent and null is
   * returned; this covers lookups made by the action itself as well as
   * those made while deciding.
   *
   * @param action The gated action.
   * @param request The incoming request.
   * @param response The response to send errors on.
   * @return The outcome, or null if a lookup failed.
   */
  @Nullable
  protected <R> GateOutcome<R> runGated(GatedAction<R> action, HttpServletRequest request,
      HttpServletResponse response)
      throws IOException {
    RequestContext context = gate.getEvaluator().makeContext(request);
    GateOutcome<R> outcome;
    try {
      outcome = action.invoke(context);
    } catch (LookupException e) {
      logger.log(Level.SEVERE, "Lookup failed while handling " + context, e);
      initErrorResponse(response, HttpServletResponse.SC_INTERNAL_SERVER_ERROR);
      return null;
    }
    sendDenial(response, outcome);
    return outcome;
  }

  /**
   * Like {@link #runGated(GatedAction, HttpServletRequest, HttpServletResponse)},
   * threading a submitted form to the action.
   */
  @Nullable
  protected <F, R> GateOutcome<R> runGated(GatedFormAction<F, R> action, F form,
      HttpServletRequest request, HttpServletResponse response)
      throws IOException {
    RequestContext context = gate.getEvaluator().makeContext(request);
    GateOutcome<R> outcome;
    try {
      outcome = action.invoke(context, form);
    } catch (LookupException e) {
      logger.log(Level.SEVERE, "Lookup failed while handling " + context, e);
      initErrorResponse(response, HttpServletResponse.SC_INTERNAL_SERVER_ERROR);
      return null;
    }
    sendDenial(response, outcome);
    return outcome;
  }

  /**
   * Sends the error response for a denied outcome.
   *
   * @return True if the outcome was a denial.
   */
  public static boolean sendDenial(HttpServletResponse response, GateOutcome<?> outcome)
      throws IOException {
    if (outcome.isAllowed()) {
      return false;
    }
    initErrorResponse(response, outcome.getStatusCode());
    return true;
  }

  public static String httpDateString() {
    return HTTP_DATE_FORMAT.print(DateTimeUtils.currentTimeMillis());
  }

  public static void initErrorResponse(HttpServletResponse response, int code)
      throws IOException {
    initResponse(response);
    response.sendError(code);
  }

  public static void initResponse(HttpServletResponse response) {
    response.setHeader("Date", httpDateString());
  }
}
