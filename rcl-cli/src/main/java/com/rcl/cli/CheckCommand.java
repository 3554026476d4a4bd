package com.rcl.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * picocli check 子命令：检查 JSON 文档是否符合类型
 */
@Command(name = "check", description = "检查 JSON 文档是否符合给定类型")
public class CheckCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Option(names = {"-t", "--type"}, required = true,
            description = "期望的类型，如 Dict[String, List[Int]]")
    String type;

    @Parameters(index = "0", description = "JSON 文档路径")
    String file;

    @Option(names = "--indent-size", defaultValue = "2", description = "诊断输出的缩进空格数（默认 2）")
    int indentSize;

    @Option(names = "--use-tabs", description = "诊断输出使用 Tab 缩进")
    boolean useTabs;

    @Override
    public Integer call() {
        CheckRunner runner = new CheckRunner(CheckRunner.printConfig(indentSize, useTabs),
                spec.commandLine().getOut(), spec.commandLine().getErr());
        return runner.checkFile(file, type);
    }
}
