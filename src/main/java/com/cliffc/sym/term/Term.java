package com.cliffc.sym.term;

import com.cliffc.sym.ast.*;
import com.cliffc.sym.util.SB;
import com.cliffc.sym.util.Util;
import org.jetbrains.annotations.NotNull;

import java.util.*;

/** One additive summand, decomposed as
 *  {@code coef * var^e... * fun^e... * nested...}.
 *
 *  <p>Variables and functions carry real exponents; a near-zero exponent is
 *  never stored.  Everything that is not a number, variable, function or a
 *  numeric power of one of those is kept verbatim as an opaque nested factor,
 *  in order.  Terms are immutable; all the arithmetic here returns new Terms.
 */
public final class Term {
  public final double _coef;
  private final HashMap<String,Double> _vars;
  private final HashMap<FunKey,Double> _funs;
  private final List<Expr> _nest;
  private String _key;          // Lazy base key

  private Term( double coef, HashMap<String,Double> vars, HashMap<FunKey,Double> funs, List<Expr> nest ) {
    _coef = coef;
    _vars = vars;
    _funs = funs;
    _nest = nest;
  }

  public static Term con( double c ) { return new Term(c,new HashMap<>(),new HashMap<>(),List.of()); }

  // Copies the maps, dropping near-zero exponents
  public static Term make( double coef, Map<String,Double> vars, Map<FunKey,Double> funs, List<Expr> nest ) {
    HashMap<String,Double> vs = new HashMap<>();
    for( Map.Entry<String,Double> e : vars.entrySet() )
      if( !Util.is_zero(e.getValue()) ) vs.put(e.getKey(),e.getValue());
    HashMap<FunKey,Double> fs = new HashMap<>();
    for( Map.Entry<FunKey,Double> e : funs.entrySet() )
      if( !Util.is_zero(e.getValue()) ) fs.put(e.getKey(),e.getValue());
    return new Term(coef,vs,fs,List.copyOf(nest));
  }

  // Decompose a factor-product
  public static @NotNull Term of( Expr e ) { return new Builder().factor(e).term(); }

  // Scoped accumulator for a single decomposition or product
  private static final class Builder {
    double _coef = 1;
    final HashMap<String,Double> _vars = new HashMap<>();
    final HashMap<FunKey,Double> _funs = new HashMap<>();
    final ArrayList<Expr> _nest = new ArrayList<>();

    Builder factor( Expr e ) {
      if( e instanceof Num n ) { _coef *= n._con; return this; }
      if( e instanceof Var v ) return var(v._name,1);
      if( e instanceof Fun f ) return fun(FunKey.make(f),1);
      Bin b = (Bin)e;
      switch( b._op ) {
      case MUL -> { factor(b._l); factor(b._r); }
      case POW -> power(b);
      default  -> _nest.add(b);  // Sums and divisions stay whole
      }
      return this;
    }
    private void power( Bin b ) {
      if( !(b._r instanceof Num n) ) { _nest.add(b); return; }
      double x = n._con;
      if( b._l instanceof Var v ) var(v._name,x);
      else if( b._l instanceof Fun f ) fun(FunKey.make(f),x);
      else if( b._l instanceof Num m && Double.isFinite(Math.pow(m._con,x)) ) _coef *= Math.pow(m._con,x);
      else _nest.add(b);        // Composite base, or a non-finite constant
    }
    Builder var( String s, double x ) { _vars.merge(s,x,Double::sum); return this; }
    Builder fun( FunKey k, double x ) { _funs.merge(k,x,Double::sum); return this; }
    Builder term( Term t ) {
      _coef *= t._coef;
      t._vars.forEach(this::var);
      t._funs.forEach(this::fun);
      _nest.addAll(t._nest);
      return this;
    }
    Term term() { return make(_coef,_vars,_funs,_nest); }
  }

  // Exponent of a variable or function; 0 when absent
  public double var( String s ) { return _vars.getOrDefault(s,0.0); }
  public double fun( FunKey k ) { return _funs.getOrDefault(k,0.0); }
  public boolean has_var( String s ) { return _vars.containsKey(s); }
  public boolean has_fun( FunKey k ) { return _funs.containsKey(k); }
  public Set<String> vars() { return Collections.unmodifiableSet(_vars.keySet()); }
  public Set<FunKey> funs() { return Collections.unmodifiableSet(_funs.keySet()); }
  public List<Expr> nested() { return _nest; }

  public boolean is_zero() { return Util.is_zero(_coef); }
  public boolean is_const() { return _vars.isEmpty() && _funs.isEmpty() && _nest.isEmpty(); }
  // Coefficient 1 and no variable or function powers; the trivial common factor
  public boolean is_unit() { return Util.is_one(_coef) && _vars.isEmpty() && _funs.isEmpty(); }

  // Total variable degree
  public double degree() {
    double d = 0;
    for( double x : _vars.values() ) d += x;
    return d;
  }

  // Like terms: same variable powers, same function powers, same nested
  // factors in the same order.  Coefficients are free.
  public boolean similar( Term t ) {
    return same(_vars,t._vars) && same(_funs,t._funs) && _nest.equals(t._nest);
  }
  private static <K> boolean same( HashMap<K,Double> a, HashMap<K,Double> b ) {
    if( a.size()!=b.size() ) return false;
    for( Map.Entry<K,Double> e : a.entrySet() ) {
      Double x = b.get(e.getKey());
      if( x==null || !Util.eq(x,e.getValue()) ) return false;
    }
    return true;
  }

  // Sum of like terms, or null if not alike
  public Term merge( Term t ) {
    return similar(t) ? new Term(_coef+t._coef,_vars,_funs,_nest) : null;
  }
  public Term set_coef( double c ) { return new Term(c,_vars,_funs,_nest); }
  public Term mul( Term t ) { return new Builder().term(this).term(t).term(); }

  // Divide out a common factor.  Remaining exponents of either sign are
  // kept; only the ones that cancel to ~0 drop out.
  public Term div( Term gcd ) {
    HashMap<String,Double> vs = new HashMap<>();
    _vars.forEach((s,x) -> vs.put(s,x-gcd.var(s)));
    HashMap<FunKey,Double> fs = new HashMap<>();
    _funs.forEach((k,x) -> fs.put(k,x-gcd.fun(k)));
    return make(_coef/gcd._coef,vs,fs,_nest);
  }

  // Deterministic grouping key over the non-coefficient content
  public String base_key() {
    if( _key != null ) return _key;
    SB sb = new SB();
    for( String s : new TreeSet<>(_vars.keySet()) ) exp(sb.p(s),_vars.get(s)).p('*');
    for( FunKey k : sorted_funs() ) exp(sb.p(k.toString()),_funs.get(k)).p('*');
    for( Expr n : _nest ) sb.p(n.toString()).p('*');
    return (_key = sb.len()==0 ? "1" : sb.unchar().toString());
  }
  // A sorted list, not a TreeSet: distinct keys can render alike
  private List<FunKey> sorted_funs() {
    ArrayList<FunKey> ks = new ArrayList<>(_funs.keySet());
    Collections.sort(ks);
    return ks;
  }
  private static SB exp( SB sb, double x ) { return Util.is_one(x) ? sb : sb.p('^').p(x); }

  // Back to a tree: sorted variable powers, sorted function powers, nested
  // factors, in a left-leaning MUL chain.  A coefficient of -1 becomes a
  // leading (-1)* and a coefficient of 1 disappears.
  public @NotNull Expr expr() {
    if( is_zero() ) return Num.ZERO;
    ArrayList<Expr> parts = new ArrayList<>();
    for( String s : new TreeSet<>(_vars.keySet()) ) parts.add(pow(Var.make(s),_vars.get(s)));
    for( FunKey k : sorted_funs() ) parts.add(pow(k.fun(),_funs.get(k)));
    parts.addAll(_nest);
    if( parts.isEmpty() ) return Num.con(_coef);
    Expr x = Expr.product(parts);
    if( Util.is_one (_coef) ) return x;
    return Bin.make(Op.MUL,Util.is_neg1(_coef) ? Num.NEG1 : Num.con(_coef),x);
  }
  private static Expr pow( Expr base, double x ) {
    return Util.is_one(x) ? base : Bin.make(Op.POW,base,Num.con(x));
  }

  @Override public String toString() {
    if( is_zero() ) return "0";
    String key = base_key();
    if( key.equals("1") ) return Util.fmt(_coef);
    if( Util.is_one (_coef) ) return key;
    if( Util.is_neg1(_coef) ) return "-"+key;
    return Util.fmt(_coef)+"*"+key;
  }
}
