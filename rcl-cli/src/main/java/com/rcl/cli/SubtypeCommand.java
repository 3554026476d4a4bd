package com.rcl.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * picocli subtype 子命令：静态检查实际类型是否满足期望类型
 */
@Command(name = "subtype", description = "静态检查实际类型是否满足期望类型（实际类型可包含 Dynamic）")
public class SubtypeCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Option(names = {"-e", "--expected"}, required = true, description = "期望的类型")
    String expected;

    @Option(names = {"-a", "--actual"}, required = true, description = "实际（推断出的）类型")
    String actual;

    @Option(names = "--indent-size", defaultValue = "2", description = "诊断输出的缩进空格数（默认 2）")
    int indentSize;

    @Option(names = "--use-tabs", description = "诊断输出使用 Tab 缩进")
    boolean useTabs;

    @Override
    public Integer call() {
        CheckRunner runner = new CheckRunner(CheckRunner.printConfig(indentSize, useTabs),
                spec.commandLine().getOut(), spec.commandLine().getErr());
        return runner.checkSubtype(expected, actual);
    }
}
