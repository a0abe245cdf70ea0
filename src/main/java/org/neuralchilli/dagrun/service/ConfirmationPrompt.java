package org.neuralchilli.dagrun.service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;

/**
 * Yes/no gate asked once before a backfill executes anything.
 */
@FunctionalInterface
public interface ConfirmationPrompt {

    ConfirmationPrompt ACCEPT = (workflowName, dates) -> true;

    ConfirmationPrompt REJECT = (workflowName, dates) -> false;

    /**
     * @return {@code true} to go ahead with the backfill
     */
    boolean confirm(String workflowName, List<LocalDate> dates);

    /**
     * Asks on standard input; only {@code y} or {@code yes} confirms.
     * End of input counts as a refusal.
     */
    static ConfirmationPrompt console() {
        return (workflowName, dates) -> {
            System.out.printf("Backfill '%s' for %d date(s) from %s to %s. Continue? (y/n): ",
                    workflowName, dates.size(),
                    dates.isEmpty() ? "-" : dates.get(0),
                    dates.isEmpty() ? "-" : dates.get(dates.size() - 1));
            System.out.flush();

            BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            try {
                String answer = reader.readLine();
                return answer != null && List.of("y", "yes").contains(answer.trim().toLowerCase());
            } catch (IOException e) {
                throw new UncheckedIOException("Could not read backfill confirmation, use auto-confirm when not interactive", e);
            }
        };
    }
}
