package org.dice.logicgraph.parsing;

import org.apache.commons.lang.CharUtils;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;

/**
 * Splits a gate expression such as {@code !(A.B).C} into symbols. Identifiers are runs of
 * ASCII letters and digits, every other character is a single symbol.
 */
public class Lexer {

    private final String inputString;
    private final WhitespaceMode whitespaceMode;
    private final int end;
    private int index;

    private String currentToken = "";
    private int position = 0;

    public static final int EOF        = -1;
    public static final int NONE       = 0;

    public static final int IDENTIFIER = 1;
    public static final int DOT        = 2;
    public static final int BANG       = 3;

    public static final int LEFT       = 6;
    public static final int RIGHT      = 7;
    public static final int INVALID    = 99;

    private static HashMap<Character, Integer> charToCode = generateCharToCode();
    private static HashMap<Character, Integer> generateCharToCode(){
        HashMap<Character, Integer> hm = new HashMap<Character, Integer>();

        hm.put('(', LEFT);
        hm.put(')', RIGHT);

        hm.put('.', DOT);
        hm.put('!', BANG);
        return hm;
    }

    public Lexer(String s) {
        this(s, WhitespaceMode.TRIM);
    }

    public Lexer(String s, WhitespaceMode whitespaceMode) {
        this.inputString = s == null ? "" : s;
        this.whitespaceMode = whitespaceMode;

        int start = 0;
        int stop = inputString.length();
        if(whitespaceMode == WhitespaceMode.TRIM){
            while (start < stop && Character.isWhitespace(inputString.charAt(start))){
                start++;
            }
            while (stop > start && Character.isWhitespace(inputString.charAt(stop - 1))){
                stop--;
            }
        }
        this.index = start;
        this.end = stop;
    }

    public int nextSymbol() {
        if(whitespaceMode == WhitespaceMode.IGNORE){
            while (index < end && Character.isWhitespace(inputString.charAt(index))){
                index++;
            }
        }

        position = index;
        if(index >= end){
            currentToken = "";
            return EOF;
        }

        char c = inputString.charAt(index);
        if(CharUtils.isAsciiAlphanumeric(c)){
            while (index < end && CharUtils.isAsciiAlphanumeric(inputString.charAt(index))){
                index++;
            }
            currentToken = inputString.substring(position, index);
            return IDENTIFIER;
        }

        index++;
        currentToken = String.valueOf(c);
        Integer code = charToCode.get(c);
        return code != null ? code : INVALID;
    }

    public static List<Integer> tokenize(String inputString){
        return tokenize(inputString, WhitespaceMode.TRIM);
    }

    public static List<Integer> tokenize(String inputString, WhitespaceMode whitespaceMode){
        // create a new lexer so as not to reset this one
        Lexer temp = new Lexer(inputString, whitespaceMode);
        List<Integer> symbols = new ArrayList<Integer>();
        int symbol;
        while ( (symbol = temp.nextSymbol()) != Lexer.EOF){
            symbols.add(symbol);
        }
        return symbols;
    }

    /**
     * @return zero-based offset of the current symbol in the original input
     */
    public int getPosition() {
        return position;
    }

    public String getInputString() {
        return inputString;
    }

    public String toString() {
        return this.currentToken;
    }
}
