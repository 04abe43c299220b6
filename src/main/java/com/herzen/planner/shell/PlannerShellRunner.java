package com.herzen.planner.shell;

import com.herzen.planner.config.PlannerProperties;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.InputStreamReader;

@Component
@ConditionalOnProperty(name = "planner.shell.enabled", havingValue = "true", matchIfMissing = true)
public class PlannerShellRunner implements CommandLineRunner {
    private final PlannerShell shell;
    private final PlannerProperties properties;

    public PlannerShellRunner(PlannerShell shell, PlannerProperties properties) {
        this.shell = shell;
        this.properties = properties;
    }

    @Override
    public void run(String... args) throws Exception {
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, properties.charset()));
        shell.run(in, System.out);
    }
}
