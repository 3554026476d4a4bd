package com.rcl.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.Charset;

/**
 * RCL CLI 入口点（picocli）
 */
@Command(name = "rcl", version = "RCL v0.1.0",
         mixinStandardHelpOptions = true,
         subcommands = {CheckCommand.class, SubtypeCommand.class})
public class Main implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        // 没有子命令时打印用法
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    public static void main(String[] args) {
        Charset charset = consoleCharset();
        PrintStream out = new PrintStream(System.out, true, charset);
        PrintStream err = new PrintStream(System.err, true, charset);
        System.setOut(out);
        System.setErr(err);
        System.exit(createCommandLine(out, err, charset).execute(args));
    }

    /**
     * 创建输出到给定流的命令行，诊断中的中文按 {@code charset} 编码
     */
    static CommandLine createCommandLine(PrintStream out, PrintStream err, Charset charset) {
        CommandLine cmd = new CommandLine(new Main());
        cmd.setOut(new PrintWriter(new OutputStreamWriter(out, charset), true));
        cmd.setErr(new PrintWriter(new OutputStreamWriter(err, charset), true));
        return cmd;
    }

    /** 终端编码：优先 native.encoding，JVM 不支持时退回默认编码 */
    static Charset consoleCharset() {
        String name = System.getProperty("native.encoding");
        if (name != null && Charset.isSupported(name)) {
            return Charset.forName(name);
        }
        return Charset.defaultCharset();
    }
}
