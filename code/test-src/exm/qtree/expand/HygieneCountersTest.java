package exm.qtree.expand;

import static org.junit.Assert.assertEquals;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.Test;

import exm.qtree.ast.Atom;

public class HygieneCountersTest {

  @Test
  public void testPerKey() {
    HygieneCounters c = new HygieneCounters();
    Atom a = Atom.alias("A");
    Atom b = Atom.alias("B");
    assertEquals(0, c.current(a));
    assertEquals(1, c.next(a));
    assertEquals(2, c.next(a));
    assertEquals(1, c.next(b));
    assertEquals(2, c.current(a));

    Map<Atom, Long> snap = c.snapshot();
    assertEquals(Long.valueOf(2), snap.get(a));
    assertEquals(Long.valueOf(1), snap.get(b));
  }

  @Test
  public void testConcurrentValuesDistinct() throws Exception {
    final HygieneCounters c = new HygieneCounters();
    final Atom key = Atom.alias("Shared");
    ExecutorService pool = Executors.newFixedThreadPool(4);
    try {
      List<Future<List<Long>>> futures = new ArrayList<Future<List<Long>>>();
      for (int t = 0; t < 4; t++) {
        futures.add(pool.submit(new Callable<List<Long>>() {
          @Override
          public List<Long> call() {
            List<Long> vals = new ArrayList<Long>();
            for (int i = 0; i < 1000; i++) {
              vals.add(c.next(key));
            }
            return vals;
          }
        }));
      }
      Set<Long> seen = new HashSet<Long>();
      for (Future<List<Long>> f: futures) {
        seen.addAll(f.get());
      }
      assertEquals(4000, seen.size());
      assertEquals(4000, c.current(key));
    } finally {
      pool.shutdown();
    }
  }
}
