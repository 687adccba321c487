package gramlab;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import gramlab.grammar.Grammar;
import gramlab.parser.TopDownInstantaneousDescription;

import static org.junit.jupiter.api.Assertions.*;

public class MainTest {

	@TempDir
	Path tempDir;

	private final ByteArrayOutputStream out = new ByteArrayOutputStream();

	private final ByteArrayOutputStream err = new ByteArrayOutputStream();

	private int run(String... args){
		return Main.run(args, new PrintStream(out, true, StandardCharsets.UTF_8),
				new PrintStream(err, true, StandardCharsets.UTF_8));
	}

	private String output(){
		return new String(out.toByteArray(), StandardCharsets.UTF_8);
	}

	private String grammarFile(String text) throws IOException {
		Path file = tempDir.resolve("grammar.txt");
		Files.write(file, text.getBytes(StandardCharsets.UTF_8));
		return file.toString();
	}

	@Test
	public void testGrammar() throws IOException {
		assertEquals(0, run("grammar", grammarFile("S -> a S | b")));
		assertTrue(output().contains("Start non terminal: S"));
	}

	@Test
	public void testAutomaton() throws IOException {
		assertEquals(0, run("automaton", grammarFile("S -> a S | b")));
		assertTrue(output().contains("transitions=(S-a->S, S-b->◇)"));
	}

	@Test
	public void testDerive() throws IOException {
		assertEquals(0, run("derive", grammarFile("S -> A B\nA -> a\nB -> b"), "rightmost", "0", "2", "1"));
		assertTrue(output().startsWith("S -> A\u200aB -> A\u200ab -> a\u200ab"));
	}

	@Test
	public void testParse() throws IOException {
		assertEquals(0, run("parse", grammarFile("S -> a B C\nB -> a B | b\nC -> a"), "aaba"));
		assertTrue(output().trim().endsWith("a\u200aa\u200ab\u200aa"));
	}

	@Test
	public void testParseRejects() throws IOException {
		assertEquals(1, run("parse", grammarFile("S -> a B C\nB -> a B | b\nC -> a"), "abb"));
	}

	@Test
	public void testErrors() throws IOException {
		assertEquals(1, run("grammar"));
		assertEquals(1, run("grammar", tempDir.resolve("missing").toString()));
		assertEquals(1, run("automaton", grammarFile("S -> S a | a")));
		assertEquals(1, run("derive", grammarFile("S -> a"), "sideways", "0"));
		assertEquals(1, run("unknown", grammarFile("S -> a")));
		assertFalse(new String(err.toByteArray(), StandardCharsets.UTF_8).isEmpty());
	}

	@Test
	public void testSearchHandlesLeftRecursion(){
		Grammar grammar = Grammar.fromText("E -> E + T | T\nT -> i");
		Optional<TopDownInstantaneousDescription> accepted = Main.parse(grammar, "i+i", 10000);
		assertTrue(accepted.isPresent());
		assertEquals(4, accepted.get().getSteps().size());
		assertFalse(Main.parse(grammar, "i+", 10000).isPresent());
	}
}
