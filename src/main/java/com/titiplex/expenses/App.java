package com.titiplex.expenses;

import com.titiplex.expenses.ui.CommandLineShell;
import org.springframework.boot.Banner;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

public class App {

    public static void main(String[] args) {
        int code;
        try (ConfigurableApplicationContext context = new SpringApplicationBuilder(SpringConfig.class)
                .web(WebApplicationType.NONE)
                .bannerMode(Banner.Mode.OFF)
                .logStartupInfo(false)
                .run()) {
            code = context.getBean(CommandLineShell.class).run(args, System.out);
        }
        System.exit(code);
    }
}
