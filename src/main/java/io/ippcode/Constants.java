package io.ippcode;

public interface Constants {

    String LANGUAGE = "IPPcode24";
    String HEADER = "." + LANGUAGE;

    String SIGNATURE_TABLE = "instructions.isa";

    int INDENT_WIDTH = 4;

    int EXIT_OK = 0;
    int EXIT_USAGE = 10;
    int EXIT_OUTPUT_FILE = 12;
    int EXIT_HEADER = 21;
    int EXIT_OPCODE = 22;
    int EXIT_OTHER = 23;
    int EXIT_INTERNAL = 99;
}
