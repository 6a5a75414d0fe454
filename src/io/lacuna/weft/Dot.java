package io.lacuna.weft;

import io.lacuna.bifurcan.*;

/**
 * Renders an automaton as a Graphviz {@code dot} description. The automaton is only read.
 */
public class Dot {

  // labels shown per edge before eliding the rest
  private static final int MAX_LABELS = 3;

  private Dot() {
  }

  public static <Q, A> String render(Automaton<Q, A> m) {
    StringBuilder sb = new StringBuilder()
            .append("digraph {\n")
            .append("  rankdir=LR;\n")
            .append("  node [fontname=Courier,fontsize=10];\n")
            .append("  node [shape=box,style=rounded];\n")
            .append("  node [height=0,width=0,margin=\"0.055,0.042\"];\n")
            .append("  edge [arrowhead=vee,arrowsize=0.5];\n")
            .append("  edge [fontname=Courier,fontsize=9];\n")
            .append("  START [label=\"\",shape=none];\n");

    IMap<Q, Integer> index = new LinearMap<>();
    for (Q q : m.states()) {
      int i = (int) index.size();
      index.put(q, i);
      sb.append("  ").append(i).append(" [label=<").append(escape(String.valueOf(q))).append(">");
      if (q.equals(m.accept())) {
        sb.append(",peripheries=2");
      }
      sb.append("];\n");
    }

    if (m.start() != null) {
      sb.append("  START->").append(index.get(m.start()).get()).append(";\n");
    }

    for (Q q : m.states()) {
      for (IEntry<Q, IList<Transition<Q, A>>> e : Utils.groupBy(m.outgoing(q), Transition::to)) {
        sb.append("  ").append(index.get(q).get())
                .append("->").append(index.get(e.key()).get())
                .append("[label=<<table border=\"0\" cellpadding=\"1\">");

        IList<Transition<Q, A>> ts = e.value();
        for (long i = 0; i < ts.size(); i++) {
          if (i >= MAX_LABELS) {
            sb.append("<tr><td>...</td></tr>");
            break;
          }
          Transition<Q, A> t = ts.nth(i);
          sb.append("<tr><td>").append(escape(t.input() + ":" + t.output())).append("</td></tr>");
        }
        sb.append("</table>>];\n");
      }
    }

    return sb.append("}\n").toString();
  }

  static String escape(String s) {
    StringBuilder sb = new StringBuilder(s.length());
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '&':
          sb.append("&amp;");
          break;
        case '<':
          sb.append("&lt;");
          break;
        case '>':
          sb.append("&gt;");
          break;
        case '"':
          sb.append("&quot;");
          break;
        case '\'':
          sb.append("&#x27;");
          break;
        default:
          sb.append(c);
      }
    }
    return sb.toString();
  }
}
