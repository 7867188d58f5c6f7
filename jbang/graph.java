///usr/bin/env jbang "$0" "$@" ; exit $?
//JAVA 17
//DEPS org.springaicommunity:social-graph-cli:1.0.0-SNAPSHOT

import org.springaicommunity.social.graph.cli.GraphClientCli;

public class graph {
    public static void main(String[] args) {
        GraphClientCli.main(args);
    }
}
