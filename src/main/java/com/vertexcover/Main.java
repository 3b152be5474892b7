package com.vertexcover;

public class Main {
    public static void main(String[] args) {
        int code = new CoverDriver().run(args);
        if (code != 0) System.exit(code);
    }
}
