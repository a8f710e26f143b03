package com.example.h3csv;

import com.example.h3csv.util.CharsetResolver;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.charset.Charset;
import java.util.Map;
import java.util.SortedMap;
import java.util.concurrent.Callable;

@Command(name = "encodings", description = "List the input encodings this JVM supports")
class EncodingsCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", paramLabel = "FILTER",
            description = "Only show names or aliases containing this text, e.g. 1388")
    private String filter;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        SortedMap<String, Charset> charsets = CharsetResolver.matching(filter);
        for (Map.Entry<String, Charset> e : charsets.entrySet()) {
            if (e.getValue().aliases().isEmpty()) {
                out.println(e.getKey());
            } else {
                out.println(e.getKey() + "  " + e.getValue().aliases());
            }
        }
        out.println(charsets.size() + " encodings");
        out.flush();
        return charsets.isEmpty() ? 1 : 0;
    }
}
