package com.isobolt.generator.cli.prompt;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.Locale;

import com.isobolt.generator.codegen.util.CountMessageUtil;
import com.isobolt.generator.reconcile.InteractionPrompt;
import com.isobolt.generator.reconcile.PreCheckSummary;
import com.isobolt.generator.reconcile.PromptChoice;

/**
 * Shows the pre-check summary on a console and reads the user's choice.
 *
 * Delete is only offered when thread materials exist. End of input cancels.
 */
public class ConsoleInteractionPrompt implements InteractionPrompt {

    private final BufferedReader in;
    private final PrintStream out;

    public ConsoleInteractionPrompt(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    @Override
    public PromptChoice choose(PreCheckSummary summary) {
        out.println();
        out.println("This command performs batch operations on ISO metric screw thread materials.");
        out.println("Working library is: " + summary.getStoreTitle());
        out.println("Summary of pre-check results:");
        summary.describe().forEach(line -> out.println("  " + line));
        out.println();

        boolean canDelete = summary.getExistingArtifacts() > 0;
        out.println("  [1] Create thread materials: "
                + CountMessageUtil.format(summary.getPlannedCreations(), "Will create {0} thread material{1}."));
        if (canDelete) {
            out.println("  [2] Delete thread materials: " + CountMessageUtil.format(summary.getExistingArtifacts(),
                    "Will delete {0} existing thread material{1}. Template or other materials will not be deleted!"));
        }
        out.println("  [0] Cancel");

        String answer = ask("Please select an option: ");
        if ("1".equals(answer)) {
            boolean overwrite = false;
            if (canDelete) {
                String yesNo = ask(CountMessageUtil.format(summary.getExistingArtifacts(),
                        "Overwrite {0} existing thread material{1}? [y/N] "));
                overwrite = yesNo != null && yesNo.toLowerCase(Locale.ROOT).startsWith("y");
            }
            return PromptChoice.create(overwrite);
        }
        if ("2".equals(answer) && canDelete) {
            return PromptChoice.delete();
        }
        return PromptChoice.cancel();
    }

    private String ask(String question) {
        out.print(question);
        out.flush();
        try {
            String line = in.readLine();
            return line != null ? line.trim() : null;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read answer from console", e);
        }
    }
}
