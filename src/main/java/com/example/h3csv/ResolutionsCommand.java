package com.example.h3csv;

import com.example.h3csv.geo.H3Resolution;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "resolutions", description = "Show the H3 resolution levels and what they suit")
class ResolutionsCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        out.println("H3 Resolution Levels");
        out.println("====================");
        out.println();
        out.printf("%-4s %-32s %s%n", "Res", "Scale & Edge Length", "Primary Use Case");
        out.printf("%-4s %-32s %s%n", "---", "--------------------------------", "-----------------------------------");
        for (H3Resolution r : H3Resolution.values()) {
            String marker = r == H3Resolution.DEFAULT ? " (default)" : "";
            out.printf("%-4d %-32s %s%s%n", r.getLevel(), r.describe(), r.getUseCase(), marker);
        }
        out.println();
        out.println("Higher resolutions give finer cells. Each cell contains 7 cells of the next level.");
        out.flush();
        return 0;
    }
}
