/**
 * Status reporting for archive operations.
 *
 * <p>{@link com.bezdurakov.common.status.StatusOr} carries either a value or a
 * {@link com.bezdurakov.common.status.Status}. Expected failures (invalid submissions, missing
 * rows, constraint violations, an unreachable database) travel as statuses, so callers branch on
 * {@code isOk()} instead of catching exceptions:
 *
 * <pre>
 * StatusOr&lt;Long&gt; gameIdOr = archive.addGame(results);
 * if (gameIdOr.isNotOk()) {
 *     Logger.error("Game was not stored: {}", gameIdOr.getStatus());
 *     return;
 * }
 * long gameId = gameIdOr.getValue();
 * </pre>
 */
package com.bezdurakov.common.status;
