package com.formpilot.infrastructure.review;

import com.formpilot.domain.form.model.PendingReviewItem;
import com.formpilot.domain.form.service.Reviewer;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

/**
 * Terminal review: prints the page summary and reads a yes/no answer.
 * End of input counts as a decline.
 */
@Slf4j
public class ConsoleReviewer implements Reviewer {

    private final BufferedReader in;
    private final PrintStream out;

    public ConsoleReviewer(InputStream in, PrintStream out) {
        this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
    }

    @Override
    public synchronized boolean presentForReview(List<PendingReviewItem> aiItems, List<PendingReviewItem> manualItems) {
        out.println();
        out.println("==== Review answers for this page ====");

        if (!aiItems.isEmpty()) {
            out.println("AI-generated answers (" + aiItems.size() + "):");
            for (PendingReviewItem item : aiItems) {
                out.println("  * " + item.question() + ": " + item.value());
                printIssues(item);
            }
        }

        if (!manualItems.isEmpty()) {
            out.println("Manual changes (" + manualItems.size() + "):");
            for (PendingReviewItem item : manualItems) {
                String type = item.fieldType() == null ? "" : " [" + item.fieldType().label() + "]";
                out.println("  * " + item.question() + type + ": '"
                        + nullToEmpty(item.originalValue()) + "' -> '" + item.value() + "'");
                printIssues(item);
            }
        }

        out.println("Answers with warnings are not saved.");

        while (true) {
            out.print("Save these answers? [y/n]: ");
            out.flush();

            String line;
            try {
                line = in.readLine();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read review decision", e);
            }

            if (line == null) {
                log.info("[Review] Input closed, declining");
                return false;
            }

            String answer = line.strip().toLowerCase(Locale.ROOT);
            if (answer.equals("y") || answer.equals("yes")) return true;
            if (answer.equals("n") || answer.equals("no")) return false;
        }
    }

    private void printIssues(PendingReviewItem item) {
        for (String issue : item.issues()) {
            out.println("      ! " + issue);
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
