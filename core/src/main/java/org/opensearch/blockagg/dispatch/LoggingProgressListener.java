/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.blockagg.dispatch;

import lombok.extern.log4j.Log4j2;

/** Reports batch progress to the log. */
@Log4j2
public class LoggingProgressListener implements ProgressListener {

  @Override
  public void onStart(String label, int total) {
    log.debug("{}: waiting for {} work units", label, total);
  }

  @Override
  public void onProgress(String label, int completed, int total) {
    log.trace("{}: {}/{} work units completed", label, completed, total);
  }

  @Override
  public void onFinish(String label, int total) {
    log.debug("{}: all {} work units completed", label, total);
  }
}
